package com.example.docxstyler.controller;

import com.example.docxstyler.config.CorsConfig;
import com.example.docxstyler.service.DocxStyleService;
import com.example.docxstyler.util.docx.InvalidDraftException;
import com.example.docxstyler.util.style.InvalidStyleMapException;
import com.example.docxstyler.util.style.StyleRuleTable;
import com.example.docxstyler.util.style.dto.StyledDocument;
import com.example.docxstyler.util.style.dto.UsageReport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Verifies request validation, headers and error mapping of the format endpoint.
 */
@WebMvcTest(controllers = DocxStyleController.class)
@Import(CorsConfig.class)
class DocxStyleControllerTest {

    private static final String DOCX_TYPE =
        "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    @Autowired
    MockMvc mockMvc;

    @MockBean
    DocxStyleService docxStyleService;

    private static MockMultipartFile draft(String filename, String text) {
        return new MockMultipartFile("draft", filename, "text/plain", text.getBytes(StandardCharsets.UTF_8));
    }

    private static StyledDocument styled(String... styleNames) {
        UsageReport report = new UsageReport();
        for (String styleName : styleNames) {
            report.increment(styleName);
        }
        return new StyledDocument(new byte[]{'P', 'K'}, styleNames.length, report);
    }

    @Test
    void format_returnsDocxWithUsageReportHeader() throws Exception {
        given(docxStyleService.format(eq("notes.txt"), any(), isNull()))
            .willReturn(styled("Heading 1", "Normal", "Normal Bullet", "Normal"));

        mockMvc.perform(multipart("/format").file(draft("notes.txt", "# Title")))
            .andExpect(status().isOk())
            .andExpect(content().contentType(DOCX_TYPE))
            .andExpect(content().bytes(new byte[]{'P', 'K'}))
            .andExpect(header().string("X-Delta-Report", "{\"Heading 1\":1,\"Normal\":2,\"Normal Bullet\":1}"))
            .andExpect(header().string("Content-Disposition", containsString("notes_styled.docx")));
    }

    @Test
    void format_passesStyleMapThrough() throws Exception {
        String styleMap = "{\"Normal\": {\"bold\": true}}";
        given(docxStyleService.format(eq("notes.txt"), any(), eq(styleMap))).willReturn(styled("Normal"));

        mockMvc.perform(multipart("/format").file(draft("notes.txt", "body")).param("style_map_json", styleMap))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Delta-Report", "{\"Normal\":1}"));
    }

    @Test
    void format_nonAsciiStyleNames_areEscapedInHeader() throws Exception {
        given(docxStyleService.format(any(), any(), any())).willReturn(styled("\u6807\u9898"));

        mockMvc.perform(multipart("/format").file(draft("notes.txt", "body")))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Delta-Report", "{\"\\u6807\\u9898\":1}"));
    }

    @Test
    void format_missingDraft_isBadRequest() throws Exception {
        mockMvc.perform(multipart("/format"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));

        verify(docxStyleService, never()).format(any(), any(), any());
    }

    @Test
    void format_zeroByteDraft_isPassedToService() throws Exception {
        given(docxStyleService.format(eq("notes.txt"), any(), isNull()))
            .willReturn(styled());

        mockMvc.perform(multipart("/format").file(draft("notes.txt", "")))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Delta-Report", "{}"));

        verify(docxStyleService).format(eq("notes.txt"), eq(new byte[0]), isNull());
    }

    @Test
    void format_unsupportedExtension_isBadRequest() throws Exception {
        mockMvc.perform(multipart("/format").file(draft("notes.pdf", "%PDF")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));

        verify(docxStyleService, never()).format(any(), any(), any());
    }

    @Test
    void format_invalidStyleMap_isBadRequest() throws Exception {
        given(docxStyleService.format(any(), any(), any()))
            .willThrow(new InvalidStyleMapException("样式表不是合法的JSON"));

        mockMvc.perform(multipart("/format").file(draft("notes.txt", "x")).param("style_map_json", "{oops"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.message", containsString("style_map_json")));
    }

    @Test
    void format_unreadableDocx_isBadRequest() throws Exception {
        given(docxStyleService.format(any(), any(), any()))
            .willThrow(new InvalidDraftException("docx文件无法解析"));

        mockMvc.perform(multipart("/format").file(draft("broken.docx", "zip?")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("docx文件无法解析"));
    }

    @Test
    void format_writeFailure_isServerError() throws Exception {
        given(docxStyleService.format(any(), any(), any())).willThrow(new IOException("disk full"));

        mockMvc.perform(multipart("/format").file(draft("notes.txt", "x")))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void defaultStyles_returnsBuiltInTable() throws Exception {
        given(docxStyleService.defaultRules()).willReturn(StyleRuleTable.defaults());

        mockMvc.perform(get("/format/styles/default"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$['Heading 1'].font_size_pt").value(14.0))
            .andExpect(jsonPath("$['Heading 4'].color").value("RGB(1,95,95)"))
            .andExpect(jsonPath("$['Normal Bullet'].indent_hanging_cm").value(0.63));
    }

    @Test
    void preflight_allowsCrossOriginPost() throws Exception {
        mockMvc.perform(options("/format")
                .header("Origin", "http://editor.example")
                .header("Access-Control-Request-Method", "POST"))
            .andExpect(status().isOk())
            .andExpect(header().string("Access-Control-Allow-Origin", "*"));
    }

    @Test
    void crossOriginResponse_exposesReportHeader() throws Exception {
        given(docxStyleService.format(any(), any(), any())).willReturn(styled("Normal"));

        mockMvc.perform(multipart("/format").file(draft("notes.txt", "x")).header("Origin", "http://editor.example"))
            .andExpect(status().isOk())
            .andExpect(header().string("Access-Control-Expose-Headers", containsString("X-Delta-Report")));
    }

    @Test
    void outputFilename_replacesExtension() {
        assertEquals("notes_styled.docx", DocxStyleController.outputFilename("notes.txt"));
        assertEquals("report.v2_styled.docx", DocxStyleController.outputFilename("report.v2.DOCX"));
        assertEquals("draft_styled.docx", DocxStyleController.outputFilename("C:\\Users\\me\\draft.txt"));
        assertEquals("document_styled.docx", DocxStyleController.outputFilename(".txt"));
    }
}
