package com.example.docxstyler.util.style;

import com.example.docxstyler.util.style.dto.StyleAttributes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 样式表 JSON 的解析与序列化
 *
 * 格式：顶层为对象，键为样式名，值为样式属性对象（字段见 {@link StyleAttributes}）。
 * 未识别的属性字段忽略；顶层或样式值不是对象、字段类型错误时拒绝。
 */
public class StyleMapParser {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private StyleMapParser() {
    }

    /**
     * 解析样式表
     *
     * @param json 样式表 JSON
     * @return 不可变规则表
     * @throws InvalidStyleMapException JSON 无法解析或结构不合法
     */
    public static StyleRuleTable parse(String json) throws InvalidStyleMapException {
        JsonNode root;
        try {
            root = JSON_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidStyleMapException("样式表不是合法的JSON: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new InvalidStyleMapException("样式表顶层必须是JSON对象");
        }

        Map<String, StyleAttributes> styles = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            styles.put(field.getKey(), parseStyle(field.getKey(), field.getValue()));
        }
        return StyleRuleTable.of(styles);
    }

    private static StyleAttributes parseStyle(String styleName, JsonNode node) throws InvalidStyleMapException {
        if (node == null || node.isNull()) {
            return StyleAttributes.EMPTY;
        }
        if (!node.isObject()) {
            throw new InvalidStyleMapException("样式 '" + styleName + "' 的值必须是JSON对象");
        }
        try {
            return JSON_MAPPER.treeToValue(node, StyleAttributes.class);
        } catch (JsonProcessingException e) {
            throw new InvalidStyleMapException("样式 '" + styleName + "' 字段不合法: " + e.getOriginalMessage(), e);
        }
    }
}
