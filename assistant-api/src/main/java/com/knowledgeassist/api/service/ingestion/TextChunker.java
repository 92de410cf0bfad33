package com.knowledgeassist.api.service.ingestion;

import java.util.List;

public interface TextChunker {

    List<Chunk> chunk(String text);
}
