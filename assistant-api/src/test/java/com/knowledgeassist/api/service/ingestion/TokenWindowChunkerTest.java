package com.knowledgeassist.api.service.ingestion;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenWindowChunkerTest {

    // One token per character keeps window arithmetic readable.
    private static final Tokenizer CHAR_TOKENIZER = new Tokenizer() {
        @Override
        public List<Integer> encode(String text) {
            return text.chars().boxed().toList();
        }

        @Override
        public String decode(List<Integer> tokens) {
            return tokens.stream().map(code -> String.valueOf((char) code.intValue())).collect(Collectors.joining());
        }
    };

    @Test
    void consecutiveChunksOverlapByConfiguredTokens() {
        TokenWindowChunker chunker = new TokenWindowChunker(CHAR_TOKENIZER, 10, 3);

        List<Chunk> chunks = chunker.chunk("abcdefghijklmnopqrstuvwxy");

        assertThat(chunks).extracting(Chunk::text)
                .containsExactly("abcdefghij", "hijklmnopq", "opqrstuvwx", "vwxy");
        assertThat(chunks).extracting(Chunk::index).containsExactly(0, 1, 2, 3);
        assertThat(chunks).extracting(Chunk::tokenCount).containsExactly(10, 10, 10, 4);
        for (int i = 1; i < chunks.size(); i++) {
            String previous = chunks.get(i - 1).text();
            assertThat(chunks.get(i).text()).startsWith(previous.substring(previous.length() - 3));
        }
    }

    @Test
    void chunksTogetherCoverTheWholeText() {
        TokenWindowChunker chunker = new TokenWindowChunker(CHAR_TOKENIZER, 8, 2);
        String text = "the quick brown fox jumps over the lazy dog";

        List<Chunk> chunks = chunker.chunk(text);

        StringBuilder rebuilt = new StringBuilder(chunks.get(0).text());
        for (int i = 1; i < chunks.size(); i++) {
            rebuilt.append(chunks.get(i).text().substring(2));
        }
        assertThat(rebuilt.toString()).isEqualTo(text);
    }

    @Test
    void emptyTextProducesNoChunks() {
        TokenWindowChunker chunker = new TokenWindowChunker(CHAR_TOKENIZER, 10, 3);

        assertThat(chunker.chunk("")).isEmpty();
        assertThat(chunker.chunk(null)).isEmpty();
    }

    @Test
    void textWithinChunkSizeProducesSingleChunk() {
        TokenWindowChunker chunker = new TokenWindowChunker(CHAR_TOKENIZER, 10, 3);

        assertThat(chunker.chunk("hello")).containsExactly(new Chunk("hello", 0, 5));
        assertThat(chunker.chunk("0123456789")).containsExactly(new Chunk("0123456789", 0, 10));
    }

    @Test
    void trimsNonFinalChunkBackToLateSentenceEnd() {
        TokenWindowChunker chunker = new TokenWindowChunker(CHAR_TOKENIZER, 10, 2);

        List<Chunk> chunks = chunker.chunk("aaaaaaaa. bbbbbbbbbbbb");

        assertThat(chunks.get(0).text()).isEqualTo("aaaaaaaa.");
        assertThat(chunks.get(0).tokenCount()).isEqualTo(10);
    }

    @Test
    void keepsWindowWhenSentenceEndIsEarly() {
        TokenWindowChunker chunker = new TokenWindowChunker(CHAR_TOKENIZER, 10, 2);

        List<Chunk> chunks = chunker.chunk("aa. bbbbbbbbbbbbbb");

        assertThat(chunks.get(0).text()).isEqualTo("aa. bbbbbb");
    }

    @Test
    void rejectsOverlapNotSmallerThanSize() {
        assertThatThrownBy(() -> new TokenWindowChunker(CHAR_TOKENIZER, 10, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenWindowChunker(CHAR_TOKENIZER, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void splitsLongTextWithBytePairTokenizer() {
        JtokkitTokenizer tokenizer = new JtokkitTokenizer();
        TokenWindowChunker chunker = new TokenWindowChunker(tokenizer, 50, 10);
        String text = "Employees accrue paid leave every month and may carry over unused days. ".repeat(40);

        List<Chunk> chunks = chunker.chunk(text);

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.tokenCount()).isBetween(1, 50));
        assertThat(tokenizer.decode(tokenizer.encode("Vacation policy."))).isEqualTo("Vacation policy.");
        assertThat(tokenizer.encode("")).isEmpty();
    }
}
