package bbt.tao.lexroute.service.context;

import bbt.tao.lexroute.service.llm.ChatTurn;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Сборка сообщений для генерации: системная инструкция, затем запрос и фрагменты в порядке приоритета.
 */
public class PromptAssembler {

    static final String SYSTEM_PROMPT = """
            Ти юридичний асистент, який допомагає користувачам з юридичними питаннями та їхніми документами.
            Використовуй наданий контекст, щоб сформувати точну і корисну відповідь.
            Якщо контекст не містить потрібної інформації, чесно про це скажи.
            """;

    static final String SWEEP_SYSTEM_PROMPT = """
            Відповідай на питання користувача ТІЛЬКИ на основі наведеного документа.
            Якщо в документі немає відповіді, відповідай одним словом NOT_FOUND.
            """;

    public List<ChatTurn> assemble(String query, AggregatedContext context) {
        String user = query;
        if (!context.fragments().isEmpty()) {
            user = query + "\n\n" + context.fragments().stream()
                    .map(ContextFragment::render)
                    .collect(Collectors.joining("\n\n"));
        }
        return List.of(ChatTurn.system(SYSTEM_PROMPT), ChatTurn.user(user));
    }

    public List<ChatTurn> assembleForDocument(String query, String documentName, String documentText) {
        Truncation.Result body = Truncation.apply(documentText, ContextBudgets.SWEEP_DOCUMENT);
        String user = "Документ: " + documentName + "\n\n" + body.text() + "\n\nПитання: " + query;
        return List.of(ChatTurn.system(SWEEP_SYSTEM_PROMPT), ChatTurn.user(user));
    }
}
