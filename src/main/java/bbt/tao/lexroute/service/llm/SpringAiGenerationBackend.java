package bbt.tao.lexroute.service.llm;

import bbt.tao.lexroute.exception.MalformedResponseException;
import bbt.tao.lexroute.exception.TransientNetworkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.retry.TransientAiException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * {@link GenerationBackend} поверх Spring AI {@link ChatClient}.
 * Модель задаётся на уровне запроса, поэтому один клиент обслуживает любые модели провайдера.
 */
@Slf4j
public class SpringAiGenerationBackend implements GenerationBackend {

    private final ChatClient chatClient;
    private final String provider;
    private final String model;

    public SpringAiGenerationBackend(ChatClient chatClient, String provider, String model) {
        this.chatClient = chatClient;
        this.provider = provider;
        this.model = model;
    }

    public SpringAiGenerationBackend withModel(String otherModel) {
        if (otherModel == null || otherModel.isBlank() || otherModel.equals(model)) {
            return this;
        }
        return new SpringAiGenerationBackend(chatClient, provider, otherModel);
    }

    @Override
    public Mono<GenerationResult> generate(List<ChatTurn> messages, double temperature, Integer maxTokens) {
        return Mono.fromCallable(() -> {
                    log.debug("[{}] generate model={} messages={} temperature={}", provider, model, messages.size(), temperature);
                    ChatResponse response = chatClient.prompt()
                            .messages(toMessages(messages))
                            .options(options(temperature, maxTokens))
                            .call()
                            .chatResponse();
                    return toResult(response);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(TransientAiException.class, e -> new TransientNetworkException(provider + ": " + e.getMessage(), e));
    }

    @Override
    public Flux<String> streamGenerate(List<ChatTurn> messages, double temperature, Integer maxTokens) {
        return Flux.defer(() -> {
                    log.debug("[{}] stream model={} messages={}", provider, model, messages.size());
                    return chatClient.prompt()
                            .messages(toMessages(messages))
                            .options(options(temperature, maxTokens))
                            .stream()
                            .content();
                })
                .onErrorMap(TransientAiException.class, e -> new TransientNetworkException(provider + ": " + e.getMessage(), e));
    }

    @Override
    public String provider() {
        return provider;
    }

    @Override
    public String model() {
        return model;
    }

    private OpenAiChatOptions options(double temperature, Integer maxTokens) {
        OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder()
                .model(model)
                .temperature(temperature);
        if (maxTokens != null && maxTokens > 0) {
            builder.maxTokens(maxTokens);
        }
        return builder.build();
    }

    private GenerationResult toResult(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new MalformedResponseException(provider + ": пустой ответ модели");
        }
        String content = response.getResult().getOutput().getText();
        String responseModel = response.getMetadata() != null && response.getMetadata().getModel() != null
                ? response.getMetadata().getModel()
                : model;
        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        TokenUsage tokens = usage == null
                ? TokenUsage.EMPTY
                : new TokenUsage(usage.getPromptTokens(), usage.getCompletionTokens(), usage.getTotalTokens());
        return new GenerationResult(content, responseModel, tokens);
    }

    private static List<Message> toMessages(List<ChatTurn> turns) {
        return turns.stream()
                .map(turn -> switch (turn.role()) {
                    case SYSTEM -> (Message) new SystemMessage(turn.content());
                    case ASSISTANT -> new AssistantMessage(turn.content());
                    case USER -> new UserMessage(turn.content());
                })
                .toList();
    }
}
