package com.jreinhal.compass.vector;

import java.util.List;

public interface EmbeddingProvider {

    float[] embed(String text);

    List<float[]> embedBatch(List<String> texts);
}
