package ch.so.arp.pdfrag.embedding;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Counts tokens the way the embedding model does. Unknown models fall back to the
 * {@code cl100k_base} encoding used by the OpenAI embedding models.
 */
public class TokenCounter {

    private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

    private final Encoding encoding;

    public TokenCounter(String model) {
        this.encoding = REGISTRY.getEncodingForModel(model)
                .orElseGet(() -> REGISTRY.getEncoding(EncodingType.CL100K_BASE));
    }

    public int count(String text) {
        return encoding.countTokens(text);
    }
}
