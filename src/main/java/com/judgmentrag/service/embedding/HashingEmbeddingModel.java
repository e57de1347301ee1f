package com.judgmentrag.service.embedding;

import java.util.ArrayList;
import java.util.List;

import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

import com.judgmentrag.util.LegalTextTokenizer;

/**
 * Local feature-hashing embedding over unigrams and bigrams, L2-normalised.
 * <p>
 * Needs no model server, so indexing and retrieval work offline. Texts that share
 * vocabulary land close together; it does not capture paraphrase.
 */
public class HashingEmbeddingModel implements EmbeddingModel {

    private static final float BIGRAM_WEIGHT = 0.5f;

    private final LegalTextTokenizer tokenizer;
    private final int dimension;

    public HashingEmbeddingModel(LegalTextTokenizer tokenizer, int dimension) {
        this.tokenizer = tokenizer;
        this.dimension = dimension;
    }

    @Override
    public EmbeddingResponse call(EmbeddingRequest request) {
        List<String> texts = request.getInstructions();
        List<Embedding> embeddings = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            embeddings.add(new Embedding(vectorize(texts.get(i)), i));
        }
        return new EmbeddingResponse(embeddings);
    }

    @Override
    public float[] embed(Document document) {
        return vectorize(document.getText());
    }

    @Override
    public int dimensions() {
        return dimension;
    }

    float[] vectorize(String text) {
        float[] vector = new float[dimension];

        for (String token : tokenizer.tokenizeUnigram(text)) {
            add(vector, token, 1.0f);
        }
        for (String bigram : tokenizer.tokenizeBigram(text)) {
            add(vector, bigram, BIGRAM_WEIGHT);
        }

        double norm = 0.0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm > 0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }

    private void add(float[] vector, String feature, float weight) {
        int hash = feature.hashCode();
        int bucket = Math.floorMod(hash, dimension);
        // second hash bit decides the sign to reduce collision bias
        float sign = ((hash >>> 16) & 1) == 0 ? 1.0f : -1.0f;
        vector[bucket] += sign * weight;
    }
}
