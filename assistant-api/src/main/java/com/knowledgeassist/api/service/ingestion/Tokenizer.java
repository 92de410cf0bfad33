package com.knowledgeassist.api.service.ingestion;

import java.util.List;

public interface Tokenizer {

    List<Integer> encode(String text);

    String decode(List<Integer> tokens);
}
