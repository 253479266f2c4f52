package com.jreinhal.compass.router;

import com.jreinhal.compass.reasoning.ReasoningStep.StepType;
import com.jreinhal.compass.reasoning.ReasoningTracer;
import com.jreinhal.compass.schema.TemplateType;
import com.jreinhal.compass.understanding.IntentType;
import com.jreinhal.compass.understanding.QueryContext;
import com.jreinhal.compass.understanding.QueryIntent;
import jakarta.annotation.PostConstruct;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * First-stage query router.
 *
 * Routes each query to one of four paths before any retrieval happens:
 * 1. INSTANT - greetings, thanks, help and small talk answered from canned text
 * 2. FALLBACK - off-topic requests outside compensation and MDRT data
 * 3. CLARIFY - ambiguous single-word domain queries and incomplete input
 * 4. RAG - everything else, handed to query understanding
 *
 * Pure pattern matching: never touches the schema cache or the vector store.
 */
@Service
public class QueryRouterService {

    private static final Logger log = LoggerFactory.getLogger(QueryRouterService.class);

    private record QuickPattern(Pattern pattern, String response, String category) {
    }

    private record CategorizedPattern(Pattern pattern, String category) {
    }

    private record AmbiguousPattern(Pattern pattern, String clarifyQuestion, String category) {
    }

    private static final int CI = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    // === INSTANT RESPONSES ===

    private static final List<QuickPattern> QUICK_PATTERNS = List.of(
            new QuickPattern(Pattern.compile("^(안녕|안녕하세요|안녕요|하이|헬로|반가워|반가워요|반갑습니다|반갑네요)[\\s!?.]*$", CI),
                    """
                    안녕하세요! 저는 수수료와 실적 관련 질문을 도와드려요.

                    이렇게 물어보세요:
                    • "내 수수료 알려줘"
                    • "이번 달 실적 확인해줘"
                    • "MDRT 달성률 얼마야?"

                    무엇이 궁금하세요?""", "greeting"),
            new QuickPattern(Pattern.compile("^(좋은\\s*(아침|오후|저녁))(이에요|입니다)?[\\s!?.]*$", CI),
                    """
                    안녕하세요! 좋은 하루 되세요.

                    수수료, 실적, MDRT 관련 질문을 도와드릴 수 있어요!""", "greeting"),
            new QuickPattern(Pattern.compile("^(고마워|고마워요|고맙습니다|감사|감사해|감사해요|감사합니다|땡큐|thank|thanks)[\\s!?.]*$", CI),
                    "도움이 되셨다니 기쁩니다! 다른 질문이 있으시면 말씀해 주세요.", "thanks"),
            new QuickPattern(Pattern.compile("^(잘가|잘가요|안녕히|안녕히요|바이|bye|굿바이|끝|종료|그만|수고|수고해|수고해요|수고하세요|수고했어요|수고하셨습니다)[\\s!?.]*$", CI),
                    "감사합니다. 좋은 하루 되세요!", "bye"),
            new QuickPattern(Pattern.compile("^(도움|도와줘|도와주세요|뭐\\s*할\\s*수\\s*있|무엇을?\\s*할\\s*수|help|도움이?\\s*필요)[\\s!?.해요]*$", CI),
                    """
                    다음과 같은 것들을 도와드릴 수 있어요:

                    📊 **수수료 조회**
                    - "이번달 수수료 알려줘"
                    - "지난달 커미션 얼마야?"

                    📈 **MDRT 현황**
                    - "MDRT 달성률 알려줘"
                    - "COT까지 얼마 남았어?"

                    📅 **일정 확인**
                    - "이번주 일정 뭐야?"
                    - "다음달 중요 일정"

                    💡 궁금한 점을 자유롭게 물어보세요!""", "help"),
            new QuickPattern(Pattern.compile("^(넌\\s*누구|너\\s*누구야|뭐야\\s*넌|who\\s*are\\s*you)[\\s!?.]*$", CI),
                    "저는 계약자허브 AI 어시스턴트입니다. 수수료, MDRT, 일정 등에 대해 도와드릴 수 있어요!", "faq"),
            new QuickPattern(Pattern.compile("^(뭐해|뭐하세요|뭐\\s*하고\\s*있어)[\\s!?.]*$", CI),
                    "저는 항상 여기서 대기하고 있어요! 수수료나 MDRT 관련해서 궁금한 게 있으시면 물어보세요.", "casual"),
            new QuickPattern(Pattern.compile("^(잘\\s*있어|잘\\s*있어요|잘\\s*지내|잘\\s*지내요|잘\\s*있니)[\\s!?.]*$", CI),
                    "네, 저는 항상 여기 있어요! 도움이 필요하시면 말씀해 주세요.", "casual"));

    // === OFF-TOPIC ===

    private static final List<CategorizedPattern> OFF_TOPIC_PATTERNS = List.of(
            new CategorizedPattern(Pattern.compile("주식|코인|비트코인|이더리움|암호화폐|투자\\s*추천|펀드\\s*추천|부동산\\s*투자|금\\s*시세", CI), "investment"),
            new CategorizedPattern(Pattern.compile("날씨|기온|비\\s*(오|올)|눈\\s*(오|올)|일기\\s*예보|우산", CI), "weather"),
            new CategorizedPattern(Pattern.compile("점심|저녁|아침\\s*메뉴|뭐\\s*먹|맛집|음식|배달|치킨|피자|햄버거|식당|카페|커피숍", CI), "food"),
            new CategorizedPattern(Pattern.compile("영화|드라마|넷플릭스|유튜브|게임|음악|노래|콘서트|공연|전시", CI), "entertainment"),
            new CategorizedPattern(Pattern.compile("코드\\s*작성|프로그래밍|코딩|개발\\s*해|python|javascript|java|html|css", CI), "coding"),
            new CategorizedPattern(Pattern.compile("주문|배송|쇼핑|쿠팡|마켓|구매\\s*추천|가격\\s*비교", CI), "shopping"),
            new CategorizedPattern(Pattern.compile("농담|웃긴|재밌는|개그|유머|심심|놀아줘", CI), "entertainment"),
            new CategorizedPattern(Pattern.compile("번역|영어로|한국어로|일본어|중국어|translate", CI), "translation"),
            new CategorizedPattern(Pattern.compile("다이어트|운동\\s*추천|헬스|요가|건강\\s*식품|영양제", CI), "health"),
            new CategorizedPattern(Pattern.compile("여행|항공권|호텔|숙소|관광|휴가|비행기", CI), "travel"));

    private static final Map<String, String> OFF_TOPIC_RESPONSES = Map.of(
            "investment", "죄송합니다, 투자나 주식 관련 정보는 제공하지 않아요. 수수료나 MDRT 관련 질문을 도와드릴 수 있어요!",
            "weather", "날씨 정보는 제공하지 않아요. 수수료 조회나 실적 확인을 도와드릴까요?",
            "food", "음식이나 맛집 정보는 제공하지 않아요. 대신 수수료나 계약 관련 질문을 도와드릴 수 있어요!",
            "entertainment", "엔터테인먼트 정보는 제공하지 않아요. 수수료, MDRT, 일정 관련해서 도움이 필요하시면 말씀해 주세요!",
            "coding", "코딩이나 개발 관련 질문은 도와드리기 어려워요. 보험 계약이나 수수료 관련 질문을 해주세요!",
            "shopping", "쇼핑이나 배송 정보는 제공하지 않아요. 수수료나 실적 관련 질문을 도와드릴까요?",
            "translation", "번역 서비스는 제공하지 않아요. 수수료 조회나 MDRT 현황 확인을 도와드릴 수 있어요!",
            "health", "건강/운동 정보는 제공하지 않아요. 대신 보험 계약이나 수수료 관련 질문을 도와드릴게요!",
            "travel", "여행 정보는 제공하지 않아요. 수수료나 실적 관련 질문을 도와드릴까요?");

    // === AMBIGUOUS DOMAIN QUERIES ===

    private static final List<AmbiguousPattern> AMBIGUOUS_PATTERNS = List.of(
            new AmbiguousPattern(Pattern.compile("^(수수료|커미션)[\\s?!.]*$", CI),
                    "수수료 관련해서 어떤 정보가 필요하세요?\n- 이번 달 수수료 확인\n- 특정 계약 수수료 조회\n- 수수료 계산 방법",
                    "compensation_ambiguous"),
            new AmbiguousPattern(Pattern.compile("^(내역|명세)[\\s?!.]*$", CI),
                    "어떤 내역이 필요하세요?\n- 수수료 내역\n- 계약 내역\n- 지급 내역",
                    "history_ambiguous"),
            new AmbiguousPattern(Pattern.compile("^(계약|보험)[\\s?!.]*$", CI),
                    "계약 관련해서 어떤 정보가 필요하세요?\n- 계약 건수 확인\n- 특정 계약 조회\n- 계약별 수수료",
                    "contract_ambiguous"),
            new AmbiguousPattern(Pattern.compile("^(정보|확인|조회)(해줘|해주세요|해봐|좀)?[\\s?!.]*$", CI),
                    "어떤 정보를 확인하고 싶으세요?\n- 수수료 정보\n- MDRT 현황\n- 계약 정보",
                    "info_ambiguous"),
            new AmbiguousPattern(Pattern.compile("^(얼마|금액|돈)(야|예요|인가요|이야)?[\\s?!.]*$", CI),
                    "어떤 금액이 궁금하세요?\n- 이번 달 수수료\n- 특정 계약 수수료\n- 목표 달성 금액",
                    "amount_ambiguous"),
            new AmbiguousPattern(Pattern.compile("^(알려줘|알려주세요|알려줄래|알고\\s*싶어|알려봐)[\\s?!.]*$", CI),
                    "무엇을 알려드릴까요?\n- 수수료 정보\n- MDRT 달성률\n- 일정 정보",
                    "request_ambiguous"));

    // === INCOMPLETE INPUT ===

    private static final int INCOMPLETE_MAX_LENGTH = 2;
    private static final Pattern DIGITS_OR_PUNCTUATION = Pattern.compile("^[\\d\\s.,!?]+$");
    private static final Pattern FILLER_WORD = Pattern.compile("^(뭐|어|음|아|그|저|이|것|거|뭐지)$");
    private static final Pattern PUNCTUATION_ONLY = Pattern.compile("^[?!.]+$");

    private static final Pattern MULTI_INTENT_CONNECTOR = Pattern.compile("그리고|또한|및|하고\\s|랑\\s");

    // === CLARIFICATION TEXT ===

    private static final List<String> MISSING_PERIOD = List.of(
            "어느 기간의 정보를 찾으시나요? (예: 이번달, 2024년 1분기)",
            "언제 정보가 필요하신가요? 특정 월이나 분기를 말씀해 주세요.");
    private static final List<String> MISSING_TEMPLATE = List.of(
            "어떤 종류의 정보가 필요하신가요? (예: 수수료, MDRT 현황, 일정)",
            "수수료 관련인가요, MDRT 관련인가요, 아니면 다른 정보인가요?");
    private static final List<String> AMBIGUOUS = List.of(
            "좀 더 구체적으로 말씀해 주시겠어요?",
            "무엇에 대해 알고 싶으신지 조금 더 설명해 주실 수 있나요?");
    private static final List<String> MULTIPLE_INTENTS = List.of(
            "여러 가지를 물어보신 것 같은데, 하나씩 답변드릴까요? 먼저 어떤 것이 궁금하세요?");

    public static final String FALLBACK_RESPONSE = """
            죄송합니다, 질문을 이해하지 못했어요.

            다음과 같이 질문해 보세요:
            - "이번달 수수료 알려줘"
            - "MDRT 달성률이 궁금해"
            - "다음주 일정 뭐야?"

            어떤 정보가 필요하신가요?""";

    private static final Set<IntentType> PERIOD_REQUIRED = EnumSet.of(
            IntentType.DIRECT_LOOKUP, IntentType.CALCULATION, IntentType.COMPARISON);

    private final ReasoningTracer reasoningTracer;

    @Value("${compass.router.enabled:true}")
    private boolean enabled;

    public QueryRouterService(ReasoningTracer reasoningTracer) {
        this.reasoningTracer = reasoningTracer;
    }

    @PostConstruct
    public void init() {
        log.info("Query router initialized (enabled={}, quickPatterns={}, offTopicPatterns={})",
                enabled, QUICK_PATTERNS.size(), OFF_TOPIC_PATTERNS.size());
    }

    public RouterDecision route(String query) {
        return route(query, null);
    }

    /**
     * Route a raw query. Stages run in order and the first match wins.
     */
    public RouterDecision route(String query, QueryContext context) {
        long startTime = System.currentTimeMillis();

        if (!enabled) {
            log.debug("Query router disabled, defaulting to RAG");
            return logAndReturn(RouteType.RAG, 0.6, "router_disabled", startTime, null, null, null);
        }

        String normalized = query == null ? "" : query.trim();

        for (QuickPattern quick : QUICK_PATTERNS) {
            if (quick.pattern().matcher(normalized).find()) {
                return logAndReturn(RouteType.INSTANT, 1.0, quick.category(), startTime,
                        quick.response(), null, quick.pattern().pattern());
            }
        }

        for (CategorizedPattern offTopic : OFF_TOPIC_PATTERNS) {
            if (offTopic.pattern().matcher(normalized).find()) {
                String response = OFF_TOPIC_RESPONSES.getOrDefault(offTopic.category(), FALLBACK_RESPONSE);
                return logAndReturn(RouteType.FALLBACK, 0.9, offTopic.category(), startTime,
                        response, null, offTopic.pattern().pattern());
            }
        }

        if (context != null && context.hasPendingClarification()) {
            return logAndReturn(RouteType.RAG, 0.8, "clarification_response", startTime, null, null, null);
        }

        for (AmbiguousPattern ambiguous : AMBIGUOUS_PATTERNS) {
            if (ambiguous.pattern().matcher(normalized).find()) {
                return logAndReturn(RouteType.CLARIFY, 0.4, ambiguous.category(), startTime,
                        null, ambiguous.clarifyQuestion(), ambiguous.pattern().pattern());
            }
        }

        if (isLikelyIncomplete(normalized)) {
            return logAndReturn(RouteType.CLARIFY, 0.3, "incomplete", startTime,
                    null, ClarificationBuilder.pick(AMBIGUOUS, normalized), null);
        }

        // Real confidence is assigned later by query understanding.
        return logAndReturn(RouteType.RAG, 0.6, null, startTime, null, null, null);
    }

    /**
     * Route an already-understood intent by its confidence band.
     */
    public RouterDecision routeWithIntent(QueryIntent intent) {
        long startTime = System.currentTimeMillis();
        RouteType route = IntentThresholds.routeForConfidence(intent.confidence());
        String clarifyQuestion = route == RouteType.CLARIFY ? buildClarificationQuestion(intent) : null;
        String response = route == RouteType.FALLBACK ? FALLBACK_RESPONSE : null;
        return logAndReturn(route, intent.confidence(), "intent_" + intent.intent().id(), startTime,
                response, clarifyQuestion, null);
    }

    /**
     * Follow-up question for the most important piece of missing context.
     */
    public String buildClarificationQuestion(QueryIntent intent) {
        String seed = intent.originalQuery();
        if (hasMultipleIntents(intent)) {
            return ClarificationBuilder.pick(MULTIPLE_INTENTS, seed);
        }
        boolean hasPeriod = intent.filters().hasPeriod() || intent.filters().hasYear();
        if (!hasPeriod && PERIOD_REQUIRED.contains(intent.intent())) {
            return ClarificationBuilder.pick(MISSING_PERIOD, seed);
        }
        if (intent.template() == null || intent.template() == TemplateType.GENERAL) {
            return ClarificationBuilder.pick(MISSING_TEMPLATE, seed);
        }
        return ClarificationBuilder.pick(AMBIGUOUS, seed);
    }

    public String getFallbackResponse() {
        return FALLBACK_RESPONSE;
    }

    public boolean isEnabled() {
        return enabled;
    }

    boolean isLikelyIncomplete(String trimmed) {
        if (trimmed.length() <= INCOMPLETE_MAX_LENGTH) {
            return true;
        }
        return DIGITS_OR_PUNCTUATION.matcher(trimmed).matches()
                || FILLER_WORD.matcher(trimmed).matches()
                || PUNCTUATION_ONLY.matcher(trimmed).matches();
    }

    private boolean hasMultipleIntents(QueryIntent intent) {
        String query = intent.originalQuery();
        if (query == null || !MULTI_INTENT_CONNECTOR.matcher(query).find()) {
            return false;
        }
        Object candidates = intent.extractedEntities().get("intentCandidates");
        if (!(candidates instanceof Collection<?> list)) {
            return false;
        }
        long distinct = list.stream()
                .filter(c -> !IntentType.DIRECT_LOOKUP.id().equals(String.valueOf(c)))
                .distinct()
                .count();
        return distinct > 1;
    }

    private RouterDecision logAndReturn(RouteType route, double confidence, String category, long startTime,
            String response, String clarifyQuestion, String matchedPattern) {
        long duration = System.currentTimeMillis() - startTime;
        RouterDecision decision = new RouterDecision(route, confidence, category, duration,
                response, clarifyQuestion, matchedPattern);
        logRoutingStep(decision);
        return decision;
    }

    private void logRoutingStep(RouterDecision decision) {
        log.debug("Router: {} ({}ms, confidence={}, category={})", decision.route(),
                decision.processingTimeMs(), decision.confidence(), decision.category());

        Map<String, Object> stepData = new LinkedHashMap<>();
        stepData.put("route", decision.route().id());
        stepData.put("confidence", decision.confidence());
        if (decision.category() != null) {
            stepData.put("category", decision.category());
        }

        reasoningTracer.addStep(
                StepType.QUERY_ROUTING,
                "Query Routing",
                String.format("%s: %s", decision.route().name(), decision.route().description()),
                decision.processingTimeMs(),
                stepData);
    }
}
