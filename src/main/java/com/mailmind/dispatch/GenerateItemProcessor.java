package com.mailmind.dispatch;

import com.mailmind.backend.GenerateOptions;
import com.mailmind.backend.InferenceClient;

/**
 * Sends the item's prompt payload to the model and returns the generated text.
 */
public class GenerateItemProcessor implements ItemProcessor<String, String> {

    private final String model;
    private final GenerateOptions options;

    public GenerateItemProcessor(String model, GenerateOptions options) {
        this.model = model;
        this.options = options;
    }

    @Override
    public String process(InferenceClient client, WorkItem<String> item) {
        return client.generate(model, item.payload(), options);
    }
}
