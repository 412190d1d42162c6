package fr.lapetina.llama.orchestrator.domain.model;

/**
 * Token count for a piece of text.
 *
 * @param count     number of tokens
 * @param estimated true when the count is a length heuristic rather than the
 *                  server tokenizer's answer
 */
public record TokenCount(int count, boolean estimated) {

    /**
     * Heuristic used when the server has no tokenize endpoint.
     */
    public static TokenCount estimate(String text) {
        return new TokenCount(text == null ? 0 : text.length() / 4, true);
    }

    public static TokenCount exact(int count) {
        return new TokenCount(count, false);
    }
}
