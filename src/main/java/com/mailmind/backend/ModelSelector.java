package com.mailmind.backend;

import com.mailmind.exception.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Chooses the model to run: the primary model when installed, otherwise the fallback.
 */
public class ModelSelector {

    private static final Logger log = LoggerFactory.getLogger(ModelSelector.class);

    private final String primaryModel;
    private final String fallbackModel;

    public ModelSelector(String primaryModel, String fallbackModel) {
        this.primaryModel = primaryModel;
        this.fallbackModel = fallbackModel;
    }

    /**
     * Select a model from the models reported by a connected client.
     *
     * @param client Connected client
     * @return The selected model identifier
     * @throws BackendUnavailableException if neither model is installed
     */
    public String select(InferenceClient client) {
        return select(client.listModels());
    }

    public String select(List<String> availableModels) {
        if (availableModels.contains(primaryModel)) {
            log.info("Primary model verified: {}", primaryModel);
            return primaryModel;
        }
        if (fallbackModel != null && availableModels.contains(fallbackModel)) {
            log.warn("Primary model {} not found, using fallback: {}", primaryModel, fallbackModel);
            return fallbackModel;
        }
        throw new BackendUnavailableException("Neither primary model (" + primaryModel
                + ") nor fallback model (" + fallbackModel + ") is available. Available models: "
                + (availableModels.isEmpty() ? "none" : String.join(", ", availableModels)));
    }
}
