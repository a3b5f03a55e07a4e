package ch.so.arp.pdfrag.ingest;

import java.io.IOException;
import java.util.regex.Pattern;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.pdfrag.exception.ExtractionException;

/**
 * {@link TextExtractor} for PDF files based on Apache PDFBox. The stripped text is
 * tidied up so that lines carry no surrounding blanks and paragraphs are separated
 * by exactly one empty line.
 */
public class PdfTextExtractor implements TextExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfTextExtractor.class);

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\h\\x0B\\f]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    @Override
    public ExtractedDocument extract(byte[] content, String filename) {
        if (content == null || content.length == 0) {
            throw new ExtractionException(filename, "the file is empty");
        }
        try (PDDocument document = Loader.loadPDF(content)) {
            if (document.isEncrypted()) {
                throw new ExtractionException(filename, "the document is encrypted");
            }
            int pages = document.getNumberOfPages();
            if (pages == 0) {
                throw new ExtractionException(filename, "the document has no pages");
            }
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = tidy(stripper.getText(document));
            LOGGER.debug("Extracted {} characters from {} pages of {}", text.length(), pages, filename);
            return new ExtractedDocument(text, pages);
        } catch (InvalidPasswordException ex) {
            throw new ExtractionException(filename, "the document is password protected", ex);
        } catch (IOException ex) {
            throw new ExtractionException(filename, "the content is not a valid PDF", ex);
        }
    }

    static String tidy(String text) {
        String unified = text.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder builder = new StringBuilder(unified.length());
        for (String line : unified.split("\n", -1)) {
            builder.append(HORIZONTAL_WHITESPACE.matcher(line).replaceAll(" ").strip()).append('\n');
        }
        return BLANK_LINES.matcher(builder).replaceAll("\n\n").strip();
    }
}
