package com.jreinhal.compass.schema;

import java.util.Map;

/**
 * Korean display names and descriptions for well-known metadata fields.
 */
public final class FieldCatalog {
    private static final Map<String, String> DISPLAY_NAMES = Map.ofEntries(
            Map.entry("period", "기간"),
            Map.entry("employeeId", "직원 ID"),
            Map.entry("employeeName", "직원명"),
            Map.entry("documentId", "문서 ID"),
            Map.entry("categoryId", "카테고리 ID"),
            Map.entry("clearanceLevel", "보안등급"),
            Map.entry("totalCommission", "총 커미션"),
            Map.entry("totalOverride", "총 오버라이드"),
            Map.entry("totalIncentive", "총 인센티브"),
            Map.entry("totalClawback", "총 환수금"),
            Map.entry("finalPayment", "최종지급액"),
            Map.entry("netPayment", "실수령액"),
            Map.entry("contractCount", "계약건수"),
            Map.entry("totalIncome", "총 소득"),
            Map.entry("fycAmount", "FYC 금액"),
            Map.entry("agiAmount", "AGI 금액"),
            Map.entry("fycMdrtProgress", "FYC MDRT 진행률"),
            Map.entry("agiMdrtProgress", "AGI MDRT 진행률"),
            Map.entry("fycMdrtStatus", "FYC MDRT 상태"),
            Map.entry("agiMdrtStatus", "AGI MDRT 상태"),
            Map.entry("title", "제목"),
            Map.entry("content", "내용"),
            Map.entry("summary", "요약"),
            Map.entry("date", "날짜"),
            Map.entry("type", "유형"));

    private static final Map<String, String> DESCRIPTIONS = Map.ofEntries(
            Map.entry("period", "데이터 기준 기간 (YYYYMM 형식)"),
            Map.entry("totalCommission", "월별 총 커미션 금액"),
            Map.entry("totalOverride", "월별 총 오버라이드 금액"),
            Map.entry("totalIncentive", "월별 총 인센티브 금액"),
            Map.entry("finalPayment", "세금/공제 후 최종 지급액"),
            Map.entry("fycAmount", "초년도 커미션 (First Year Commission)"),
            Map.entry("agiAmount", "조정후 총소득 (Adjusted Gross Income)"),
            Map.entry("clearanceLevel", "문서 접근 권한 수준 (basic/standard/advanced)"));

    private FieldCatalog() {}

    public static String displayName(String fieldName) {
        return DISPLAY_NAMES.getOrDefault(fieldName, fieldName);
    }

    public static String description(String fieldName) {
        String description = DESCRIPTIONS.get(fieldName);
        return description != null ? description : fieldName + " 필드";
    }
}
