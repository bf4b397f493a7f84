package org.example.pdfchat.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.HttpHeaders;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.example.pdfchat.common.exception.MalformedDocumentException;
import org.example.pdfchat.model.ExtractedDocument;
import org.example.pdfchat.model.ExtractedPage;
import org.springframework.stereotype.Component;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 文本提取，基于 Tika 自动识别格式。
 * PDF 这类分页格式按页返回，页码从 1 开始；其他格式整体作为一页，页码为 null。
 */
@Slf4j
@Component
public class DocumentTextExtractor {

    private final Parser parser = new AutoDetectParser();

    public ExtractedDocument extract(InputStream stream, String filename, String contentType) {
        Metadata metadata = new Metadata();
        if (filename != null) {
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
        }
        if (contentType != null) {
            metadata.set(HttpHeaders.CONTENT_TYPE, contentType);
        }
        ParseContext context = new ParseContext();
        context.set(Parser.class, parser);
        PageCollectingHandler handler = new PageCollectingHandler();
        try {
            parser.parse(stream, handler, metadata, context);
        } catch (TikaException | SAXException e) {
            throw new MalformedDocumentException("文档解析失败: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedDocumentException("读取文档失败: " + e.getMessage(), e);
        }
        List<ExtractedPage> pages = handler.pages();
        String detectedType = metadata.get(HttpHeaders.CONTENT_TYPE);
        log.debug("文本提取完成，文件: {}, 类型: {}, 页数: {}", filename, detectedType, pages.size());
        return new ExtractedDocument(detectedType != null ? detectedType : contentType, pages);
    }

    /**
     * 清洗文本：合并连续空白和空行，去掉首尾空白
     */
    static String normalize(String text) {
        return text.replace('\u00A0', ' ')
                .replaceAll("[ \\t\\x0B\\f\\r]+", " ")
                .replaceAll(" *\\n *", "\n")
                .replaceAll("\\n+", "\n")
                .trim();
    }

    /**
     * 收集 XHTML 事件中的文本，遇到 div.page 时切换到新的一页
     */
    static class PageCollectingHandler extends DefaultHandler {
        private static final Set<String> BLOCK_ELEMENTS = Set.of("p", "br", "li", "tr", "h1", "h2", "h3", "h4", "h5", "h6");
        private final List<ExtractedPage> pages = new ArrayList<>();
        private final StringBuilder loose = new StringBuilder();
        private StringBuilder current;
        private int divDepth;
        private int pageDivDepth = -1;
        // <head> 里是元数据，不算正文
        private boolean inHead;

        @Override
        public void startElement(String uri, String localName, String qName, Attributes atts) {
            String name = localName == null || localName.isEmpty() ? qName : localName;
            if ("head".equals(name)) {
                inHead = true;
            } else if ("div".equals(name)) {
                divDepth++;
                if (current == null && "page".equals(atts.getValue("class"))) {
                    current = new StringBuilder();
                    pageDivDepth = divDepth;
                }
            } else if (isBlock(name)) {
                buffer().append('\n');
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            String name = localName == null || localName.isEmpty() ? qName : localName;
            if ("head".equals(name)) {
                inHead = false;
            } else if ("div".equals(name)) {
                if (current != null && divDepth == pageDivDepth) {
                    pages.add(new ExtractedPage(pages.size() + 1, normalize(current.toString())));
                    current = null;
                    pageDivDepth = -1;
                }
                divDepth--;
            } else if (isBlock(name)) {
                buffer().append('\n');
            }
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (!inHead) {
                buffer().append(ch, start, length);
            }
        }

        @Override
        public void ignorableWhitespace(char[] ch, int start, int length) {
            if (!inHead) {
                buffer().append(ch, start, length);
            }
        }

        List<ExtractedPage> pages() {
            if (pages.isEmpty()) {
                return List.of(new ExtractedPage(null, normalize(loose.toString())));
            }
            return pages;
        }

        private StringBuilder buffer() {
            return current != null ? current : loose;
        }

        private static boolean isBlock(String name) {
            return BLOCK_ELEMENTS.contains(name);
        }
    }
}
