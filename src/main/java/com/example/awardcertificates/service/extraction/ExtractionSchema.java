package com.example.awardcertificates.service.extraction;

import com.example.awardcertificates.model.CertificateField;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Fixed field schema and prompt sent with every certificate image.
 */
public final class ExtractionSchema {

    private static final String PROMPT = buildPrompt();

    private ExtractionSchema() {
    }

    public static String prompt() {
        return PROMPT;
    }

    private static String buildPrompt() {
        String jsonTemplate = Arrays.stream(CertificateField.values())
                .map(field -> "    \"" + field.wireName() + "\": \"" + field.label() + "\"")
                .collect(Collectors.joining(",\n", "{\n", "\n}"));
        return """
                请仔细分析这张竞赛证书图片，提取以下信息：学生所在学院、竞赛项目名称、学号（13位数字）、学生姓名、\
                获奖类别（国家级/省级）、获奖等级（一等奖/二等奖/三等奖/金奖/银奖/铜奖/优秀奖等）、竞赛类型（A类/B类）、\
                主办单位、获奖时间（日期格式）、指导教师姓名。

                请按照以下JSON格式返回结果，如果某个字段无法识别，请设置为null：

                """ + jsonTemplate + """


                请直接返回JSON，不要添加其他说明文字。""";
    }
}
