package com.example.docxstyler.service;

import com.example.docxstyler.util.docx.InvalidDraftException;
import com.example.docxstyler.util.style.InvalidStyleMapException;
import com.example.docxstyler.util.style.StyleRuleTable;
import com.example.docxstyler.util.style.dto.StyledDocument;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests the request-level formatting flow without the web layer.
 */
class DocxStyleServiceTest {

    private final DocxStyleService service = new DocxStyleService();

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void format_txtWithDefaults_producesReadableDocx() throws Exception {
        StyledDocument result = service.format("draft.txt",
            utf8("# Title\nIntro text.\n- point one\n1. first item\n"), null);

        assertEquals(4, result.getParagraphCount());
        assertEquals(1, result.getUsageReport().count("Heading 1"));
        assertEquals(2, result.getUsageReport().count("Normal"));
        assertEquals(1, result.getUsageReport().count("Normal Bullet"));

        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(result.getContent()))) {
            assertEquals(4, document.getParagraphs().size());
            XWPFParagraph title = document.getParagraphs().get(0);
            assertEquals("Title", title.getText());
            assertEquals("0052A3", title.getRuns().get(0).getColor());
            assertEquals("first item", document.getParagraphs().get(3).getText());
        }
    }

    @Test
    void format_customStyleMap_replacesDefaults() throws Exception {
        String styleMap = "{\"Normal\": {\"font_name\": \"Arial\", \"font_size_pt\": 11}}";

        StyledDocument result = service.format("draft.txt", utf8("- bullet\nbody"), styleMap);

        assertEquals(1, result.getUsageReport().count("List Paragraph Bullet Points"));
        assertEquals(1, result.getUsageReport().count("Normal"));
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(result.getContent()))) {
            assertEquals(null, document.getParagraphs().get(0).getRuns().get(0).getFontFamily());
            assertEquals("Arial", document.getParagraphs().get(1).getRuns().get(0).getFontFamily());
        }
    }

    @Test
    void format_blankStyleMap_usesDefaults() throws Exception {
        StyledDocument result = service.format("draft.txt", utf8("- bullet"), "   ");

        assertEquals(Collections.singletonMap("Normal Bullet", 1), result.getUsageReport().asMap());
    }

    @Test
    void format_docxDraft_restylesParagraphText() throws Exception {
        byte[] source;
        try (XWPFDocument draft = new XWPFDocument()) {
            draft.createParagraph().createRun().setText("H2: Scope");
            draft.createParagraph().createRun().setText("Plain words");
            java.io.ByteArrayOutputStream out = new java.io.ByteArrayOutputStream();
            draft.write(out);
            source = out.toByteArray();
        }

        StyledDocument result = service.format("existing.docx", source, null);

        assertEquals(1, result.getUsageReport().count("Heading 2"));
        assertEquals(1, result.getUsageReport().count("Normal"));
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(result.getContent()))) {
            assertEquals("Scope", document.getParagraphs().get(0).getText());
        }
    }

    @Test
    void format_emptyTxt_producesEmptyDocument() throws Exception {
        StyledDocument result = service.format("empty.txt", new byte[0], null);

        assertEquals(0, result.getParagraphCount());
        assertTrue(result.getUsageReport().isEmpty());
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(result.getContent()))) {
            assertTrue(document.getParagraphs().isEmpty());
        }
    }

    @Test
    void format_invalidStyleMap_isRejectedBeforeReading() {
        assertThrows(InvalidStyleMapException.class,
            () -> service.format("draft.pdf", utf8("x"), "{not json"));
    }

    @Test
    void format_unsupportedDraft_isRejected() {
        assertThrows(InvalidDraftException.class, () -> service.format("draft.pdf", utf8("x"), null));
    }

    @Test
    void defaultRules_isTheSharedBuiltInTable() {
        assertSame(StyleRuleTable.defaults(), service.defaultRules());
    }
}
