package com.example.awardcertificates.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Certificate fields that can be extracted from a document or entered by the
 * submitter. The wire name is used in the recognition schema and at the REST
 * boundary.
 */
public enum CertificateField {
    STUDENT_ID("student_id", "学号"),
    STUDENT_NAME("student_name", "学生姓名"),
    DEPARTMENT("department", "学生所在学院"),
    COMPETITION_NAME("competition_name", "竞赛项目"),
    AWARD_CATEGORY("award_category", "获奖类别"),
    AWARD_LEVEL("award_level", "获奖等级"),
    COMPETITION_TYPE("competition_type", "竞赛类型"),
    ORGANIZER("organizer", "主办单位"),
    AWARD_DATE("award_date", "获奖时间"),
    ADVISOR("advisor", "指导教师");

    private final String wireName;
    private final String label;

    CertificateField(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    public String wireName() {
        return wireName;
    }

    public String label() {
        return label;
    }

    public static Optional<CertificateField> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        String candidate = wireName.trim();
        return Arrays.stream(values())
                .filter(field -> field.wireName.equals(candidate) || field.name().equalsIgnoreCase(candidate))
                .findFirst();
    }
}
