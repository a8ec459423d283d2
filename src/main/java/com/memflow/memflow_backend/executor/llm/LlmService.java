package com.memflow.memflow_backend.executor.llm;

import com.memflow.memflow_backend.model.domain.ModelConfig;
import com.memflow.memflow_backend.model.llm.LlmRequest;
import com.memflow.memflow_backend.model.llm.LlmResponse;
import com.memflow.memflow_backend.repository.ModelConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Resolves a node's {@code model_id} against the stored model configurations and
 * dispatches the request to the matching provider client. Never throws: an unknown or
 * disabled model comes back as an error response.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmService {

    private final ModelConfigRepository modelConfigRepository;
    private final LlmClientFactory clientFactory;

    public LlmResponse complete(String modelId, LlmRequest request) {
        return invoke(modelId, request, null);
    }

    /** Streams when {@code onChunk} is non-null, otherwise performs a blocking call. */
    public LlmResponse invoke(String modelId, LlmRequest request, Consumer<String> onChunk) {
        Optional<ModelConfig> found = findModel(modelId);
        if (found.isEmpty()) {
            return LlmResponse.error("Model not found: " + modelId);
        }
        ModelConfig model = found.get();
        if (!model.isEnabled()) {
            return LlmResponse.error("Model is disabled: " + model.getName());
        }

        LlmClient client;
        try {
            client = clientFactory.getClient(model.getProvider());
        } catch (IllegalArgumentException e) {
            return LlmResponse.error(e.getMessage());
        }
        request.setModel(model.getModelName());
        log.debug("Calling {} model {} (stream={})", model.getProvider(), model.getModelName(), onChunk != null);
        return onChunk != null
                ? client.stream(request, model.getApiKey(), model.getEndpoint(), onChunk)
                : client.call(request, model.getApiKey(), model.getEndpoint());
    }

    private Optional<ModelConfig> findModel(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            return Optional.empty();
        }
        try {
            Optional<ModelConfig> byId = modelConfigRepository.findById(UUID.fromString(modelId));
            if (byId.isPresent()) {
                return byId;
            }
        } catch (IllegalArgumentException notAUuid) {
            log.debug("model_id '{}' is not a UUID, looking it up by name", modelId);
        }
        return modelConfigRepository.findByName(modelId);
    }
}
