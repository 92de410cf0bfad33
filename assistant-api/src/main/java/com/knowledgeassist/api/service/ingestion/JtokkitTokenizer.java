package com.knowledgeassist.api.service.ingestion;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * cl100k_base byte-pair encoding, the vocabulary shared by the embedding and completion models.
 */
@Component
public class JtokkitTokenizer implements Tokenizer {

    private final EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
    private final Encoding encoding = registry.getEncoding(EncodingType.CL100K_BASE);

    @Override
    public List<Integer> encode(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        IntArrayList encoded = encoding.encodeOrdinary(text);
        List<Integer> tokens = new ArrayList<>(encoded.size());
        for (int i = 0; i < encoded.size(); i++) {
            tokens.add(encoded.get(i));
        }
        return tokens;
    }

    @Override
    public String decode(List<Integer> tokens) {
        IntArrayList buffer = new IntArrayList(tokens.size());
        for (Integer token : tokens) {
            buffer.add(token);
        }
        return encoding.decode(buffer);
    }
}
