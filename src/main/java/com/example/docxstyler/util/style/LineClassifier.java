package com.example.docxstyler.util.style;

import com.example.docxstyler.util.style.dto.ClassifiedLine;
import com.example.docxstyler.util.style.rule.BulletRule;
import com.example.docxstyler.util.style.rule.ClassificationRule;
import com.example.docxstyler.util.style.rule.PatternRule;
import com.example.docxstyler.util.style.rule.PrefixRule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 行分类器
 *
 * 规则顺序（先命中者优先，顺序不可调整）：
 * 1. 标题：Heading 1 -> Heading 4，每级依次尝试 "Hn:" 和 "#...# "
 * 2. 编号列表："1. " "1) " "a. " "A) "，归为 Normal，编号被去掉且不重新生成
 * 3. 项目符号："- " "* " "• "，优先 Normal Bullet，否则 List Paragraph Bullet Points
 * 4. 默认：Normal，文本不变
 *
 * 分类不会失败，最差情况落入默认分支。
 */
public class LineClassifier {

    private static final char BOM = '\uFEFF';

    /**
     * 编号：一个或多个数字 / 单个字母，后跟 "." 或 ")" 和一个空白（含不间断空格）
     */
    public static final Pattern NUMBERED_PATTERN = Pattern.compile(
        "^(\\d+[.)][\\s\\x1C-\\x1F]|[A-Za-z][.)][\\s\\x1C-\\x1F])", Pattern.UNICODE_CHARACTER_CLASS);

    public static final List<String> BULLET_MARKERS = Collections.unmodifiableList(
        Arrays.asList("- ", "* ", "\u2022 "));

    public static final List<String> BULLET_STYLE_CANDIDATES = Collections.unmodifiableList(
        Arrays.asList(StyleNames.NORMAL_BULLET, StyleNames.LIST_PARAGRAPH_BULLET_POINTS));

    private static final LineClassifier STANDARD = new LineClassifier(standardRules());

    private final List<ClassificationRule> rules;

    public LineClassifier(List<ClassificationRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    /**
     * 标准规则顺序的分类器
     */
    public static LineClassifier standard() {
        return STANDARD;
    }

    /**
     * 标准规则列表：标题 -> 编号 -> 项目符号
     */
    public static List<ClassificationRule> standardRules() {
        List<ClassificationRule> rules = new ArrayList<>();
        for (int level = 1; level <= 4; level++) {
            rules.add(new PrefixRule(StyleNames.heading(level),
                Arrays.asList("H" + level + ":", TextUtils.repeatString("#", level) + " ")));
        }
        rules.add(new PatternRule(StyleNames.NORMAL, NUMBERED_PATTERN));
        rules.add(new BulletRule(BULLET_MARKERS, BULLET_STYLE_CANDIDATES));
        return rules;
    }

    /**
     * 分类一行
     *
     * @param line 原始行，可为 null
     * @param styles 当前请求的样式规则表
     * @return 分类结果
     */
    public ClassifiedLine classify(String line, StyleRuleTable styles) {
        String text = normalize(line);
        for (ClassificationRule rule : rules) {
            ClassifiedLine classified = rule.classify(line, text, styles);
            if (classified != null) {
                return classified;
            }
        }
        return new ClassifiedLine(line, StyleNames.NORMAL, text);
    }

    public List<ClassificationRule> getRules() {
        return rules;
    }

    /**
     * 归一化：去掉行尾的 \r / \n，去掉行首 BOM
     *
     * 多次调用结果与一次调用相同。
     */
    public static String normalize(String line) {
        if (line == null) {
            return "";
        }
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        int start = 0;
        while (start < end && line.charAt(start) == BOM) {
            start++;
        }
        return line.substring(start, end);
    }
}
