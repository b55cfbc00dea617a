package com.example.docxstyler.controller;

import com.example.docxstyler.service.DocxStyleService;
import com.example.docxstyler.util.docx.DocxWriter;
import com.example.docxstyler.util.docx.DraftReader;
import com.example.docxstyler.util.docx.InvalidDraftException;
import com.example.docxstyler.util.style.InvalidStyleMapException;
import com.example.docxstyler.util.style.StyleRuleTable;
import com.example.docxstyler.util.style.dto.StyledDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * 文档排版控制器
 */
@Slf4j
@RestController
@RequestMapping("/format")
public class DocxStyleController {

    @Autowired
    private DocxStyleService docxStyleService;

    @Autowired
    private ObjectMapper objectMapper;

    /**
     * 样式统计响应头名称
     */
    @Value("${styler.report-header:X-Delta-Report}")
    private String reportHeader;

    /**
     * 上传草稿并返回排版后的 docx
     *
     * 样式使用统计以 JSON 形式放在响应头中（默认 X-Delta-Report）。
     *
     * @param draft 草稿文件（.txt 或 .docx）
     * @param styleMapJson 可选，覆盖默认样式表的 JSON
     * @return docx 文件；参数错误时返回 400 和错误信息
     */
    @PostMapping
    public ResponseEntity<?> format(
            @RequestParam(value = "draft", required = false) MultipartFile draft,
            @RequestParam(value = "style_map_json", required = false) String styleMapJson) {

        // 0 字节的 .txt 是合法输入（得到空文档）；空 .docx 由 DraftReader 拒绝
        if (draft == null) {
            return error(HttpStatus.BAD_REQUEST, "缺少draft文件");
        }

        String originalFilename = draft.getOriginalFilename();
        if (!DraftReader.isSupported(originalFilename)) {
            log.warn("不支持的文件类型: {}", originalFilename);
            return error(HttpStatus.BAD_REQUEST, "只支持.txt或.docx文件");
        }

        try {
            log.info("接收文件: {}, 自定义样式表={}", originalFilename, styleMapJson != null && !styleMapJson.trim().isEmpty());
            StyledDocument result = docxStyleService.format(originalFilename, draft.getBytes(), styleMapJson);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType(DocxWriter.CONTENT_TYPE));
            headers.setContentDisposition(ContentDisposition.attachment()
                .filename(outputFilename(originalFilename), StandardCharsets.UTF_8)
                .build());
            // 响应头只允许 ASCII，非 ASCII 样式名需转义
            headers.set(reportHeader, objectMapper.writer()
                .with(JsonWriteFeature.ESCAPE_NON_ASCII)
                .writeValueAsString(result.getUsageReport()));

            return new ResponseEntity<>(result.getContent(), headers, HttpStatus.OK);

        } catch (InvalidStyleMapException e) {
            log.warn("样式表不合法: {}", e.getMessage());
            return error(HttpStatus.BAD_REQUEST, "style_map_json不合法: " + e.getMessage());
        } catch (InvalidDraftException e) {
            log.warn("草稿无法读取: file={}, error={}", originalFilename, e.getMessage());
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (JsonProcessingException e) {
            log.error("样式统计序列化失败: {}", e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "样式统计序列化失败: " + e.getMessage());
        } catch (IOException e) {
            log.error("排版失败: file={}, error={}", originalFilename, e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "排版失败: " + e.getMessage());
        }
    }

    /**
     * 查询内置默认样式表，可作为 style_map_json 的模板
     */
    @GetMapping("/styles/default")
    public ResponseEntity<StyleRuleTable> defaultStyles() {
        return ResponseEntity.ok(docxStyleService.defaultRules());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> result = new HashMap<>();
        result.put("success", false);
        result.put("message", message);
        return ResponseEntity.status(status).body(result);
    }

    /**
     * 输出文件名：原文件名去掉扩展名后加 "_styled.docx"
     */
    static String outputFilename(String originalFilename) {
        String base = originalFilename;
        int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        int dot = base.lastIndexOf('.');
        if (dot >= 0) {
            base = base.substring(0, dot);
        }
        if (base.isEmpty()) {
            base = "document";
        }
        return base + "_styled.docx";
    }
}
