package com.example.docxstyler.util.docx;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.xmlbeans.XmlCursor;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import javax.xml.namespace.QName;

/**
 * 草稿读取工具
 *
 * 将上传文件解码为有序的文本行：
 * - .txt：UTF-8 解码，非法字节直接丢弃，按通用换行符拆行
 * - .docx：取正文每个段落的纯文本，原有格式丢弃
 */
@Slf4j
public class DraftReader {

    /**
     * 行分隔符：\r\n 以及 \n \r VT FF FS GS RS NEL LS PS
     */
    private static final Pattern LINE_BREAK =
        Pattern.compile("\r\n|[\n\r\\x0B\\f\\x1C\\x1D\\x1E\\x85\\u2028\\u2029]");

    private static final String NS_W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";

    private static final QName BR_TYPE = new QName(NS_W, "type");

    private DraftReader() {
    }

    /**
     * 是否为支持的文件类型
     */
    public static boolean isSupported(String filename) {
        return DraftType.of(filename) != null;
    }

    /**
     * 读取草稿为文本行
     *
     * @param filename 原始文件名（用于判断类型）
     * @param data 文件内容
     * @return 文本行列表
     * @throws InvalidDraftException 文件类型不支持或 docx 无法解析
     */
    public static List<String> readLines(String filename, byte[] data) throws InvalidDraftException {
        DraftType type = DraftType.of(filename);
        if (type == null) {
            throw new InvalidDraftException("不支持的文件类型（仅支持 .txt 或 .docx）: " + filename);
        }

        switch (type) {
            case TXT:
                return splitLines(decodeUtf8(data));
            case DOCX:
                return readDocxParagraphs(data);
            default:
                throw new InvalidDraftException("不支持的文件类型: " + filename);
        }
    }

    /**
     * UTF-8 解码，丢弃非法字节序列
     */
    public static String decodeUtf8(byte[] data) {
        if (data == null || data.length == 0) {
            return "";
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            return decoder.decode(ByteBuffer.wrap(data)).toString();
        } catch (CharacterCodingException e) {
            // IGNORE 模式下不会发生
            throw new IllegalStateException(e);
        }
    }

    /**
     * 按行拆分，行尾分隔符不产生额外的空行；空文本返回空列表
     */
    public static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> lines = new ArrayList<>();
        Collections.addAll(lines, LINE_BREAK.split(text, -1));
        if (lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    /**
     * 提取 docx 正文段落文本（不含表格、页眉页脚）
     */
    private static List<String> readDocxParagraphs(byte[] data) throws InvalidDraftException {
        if (data == null || data.length == 0) {
            throw new InvalidDraftException("docx文件为空");
        }
        try (InputStream is = new ByteArrayInputStream(data);
             XWPFDocument document = new XWPFDocument(is)) {

            List<String> lines = new ArrayList<>();
            for (XWPFParagraph paragraph : document.getParagraphs()) {
                lines.add(paragraphText(paragraph));
            }
            log.info("docx读取完成: {} 个段落", lines.size());
            return lines;
        } catch (IOException | RuntimeException e) {
            // POI 对损坏文件会抛出多种运行时异常（NotOfficeXmlFileException、POIXMLException 等）
            throw new InvalidDraftException("docx文件无法解析: " + e.getMessage(), e);
        }
    }

    /**
     * 段落纯文本，由各 Run 拼接
     *
     * 不用 {@link XWPFParagraph#getText()}：它会带上 "[footnoteRef:1]" 这类脚注/批注引用标记。
     */
    static String paragraphText(XWPFParagraph paragraph) {
        StringBuilder sb = new StringBuilder();
        for (XWPFRun run : paragraph.getRuns()) {
            appendRunText(run, sb);
        }
        return sb.toString();
    }

    /**
     * 按子元素顺序拼接 Run 文本：w:t 原文，w:tab / w:ptab 为制表符，
     * w:br（仅换行类型）/ w:cr 为换行，w:noBreakHyphen 为连字符；引用标记、域代码等忽略
     */
    private static void appendRunText(XWPFRun run, StringBuilder sb) {
        try (XmlCursor c = run.getCTR().newCursor()) {
            if (!c.toFirstChild()) {
                return;
            }
            do {
                QName name = c.getName();
                if (name == null || !NS_W.equals(name.getNamespaceURI())) {
                    continue;
                }
                switch (name.getLocalPart()) {
                    case "t":
                        sb.append(c.getTextValue());
                        break;
                    case "tab":
                    case "ptab":
                        sb.append('\t');
                        break;
                    case "br":
                        String type = c.getAttributeText(BR_TYPE);
                        if (type == null || "textWrapping".equals(type)) {
                            sb.append('\n');
                        }
                        break;
                    case "cr":
                        sb.append('\n');
                        break;
                    case "noBreakHyphen":
                        sb.append('-');
                        break;
                    default:
                        break;
                }
            } while (c.toNextSibling());
        }
    }

    /**
     * 支持的草稿类型，按扩展名判断（不区分大小写）
     */
    enum DraftType {
        TXT(".txt"),
        DOCX(".docx");

        private final String extension;

        DraftType(String extension) {
            this.extension = extension;
        }

        static DraftType of(String filename) {
            if (filename == null) {
                return null;
            }
            String lower = filename.toLowerCase(Locale.ROOT);
            for (DraftType type : values()) {
                if (lower.endsWith(type.extension)) {
                    return type;
                }
            }
            return null;
        }
    }
}
