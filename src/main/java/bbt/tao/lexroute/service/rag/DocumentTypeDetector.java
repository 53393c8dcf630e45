package bbt.tao.lexroute.service.rag;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Определение типа документа по ключевым словам и фразам в тексте и имени файла.
 * Ключевое слово в тексте даёт 1 балл, в имени файла 0.5, фраза в тексте 2.
 * Уверенность равна доле лучшего типа в сумме баллов; ниже {@value #MIN_CONFIDENCE} тип считается неизвестным.
 */
public class DocumentTypeDetector {

    public static final String UNKNOWN = "unknown";
    static final double MIN_CONFIDENCE = 0.3;

    public record Detection(String type, double confidence) {
    }

    private record Patterns(List<String> keywords, List<String> phrases) {
    }

    private static final Map<String, Patterns> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put("contract", new Patterns(
                List.of("договор", "контракт", "соглашение", "договір", "стороны", "сторона", "исполнитель",
                        "заказчик", "подрядчик", "предмет договора", "предмет договору", "условия договора",
                        "срок действия", "термін дії", "расторжение", "розірвання"),
                List.of("договор о", "договор на", "договор между", "договір про", "заключили настоящий договор",
                        "уклали цей договір", "настоящий договор", "цей договір")));
        PATTERNS.put("court_case", new Patterns(
                List.of("суд", "судова", "справа", "рішення", "постановление", "постанова", "приговор", "вирок",
                        "истец", "позивач", "ответчик", "відповідач", "судья", "суддя", "судопроизводство",
                        "судочинство", "исковое заявление", "позовна заява"),
                List.of("судебное дело", "судова справа", "дело №", "справа №", "решение суда", "рішення суду",
                        "постановление суда", "постанова суду")));
        PATTERNS.put("invoice", new Patterns(
                List.of("счет", "рахунок", "invoice", "накладная", "накладна", "квитанция", "квитанція", "чек",
                        "сумма к оплате", "сума до оплати", "итого", "підсумок"),
                List.of("счет на оплату", "рахунок на оплату", "выставить счет", "виставити рахунок", "к оплате",
                        "до оплати")));
        PATTERNS.put("certificate", new Patterns(
                List.of("справка", "довідка", "свидетельство", "свідоцтво", "сертификат", "сертифікат",
                        "удостоверение", "посвідчення"),
                List.of("выдана справка", "видана довідка", "настоящая справка", "ця довідка")));
        PATTERNS.put("act", new Patterns(
                List.of("акт", "приемки", "приймання", "выполненных работ", "виконаних робіт", "оказанных услуг",
                        "наданих послуг"),
                List.of("акт выполненных работ", "акт виконаних робіт", "акт оказанных услуг", "акт наданих послуг",
                        "акт приема-передачи", "акт прийому-передачі")));
        PATTERNS.put("power_of_attorney", new Patterns(
                List.of("доверенность", "довіреність", "уполномочиваю", "повноважу", "представитель", "представник",
                        "доверитель", "довіритель"),
                List.of("настоящая доверенность", "ця довіреність", "доверяю право", "довіряю право")));
    }

    public Detection detect(String text, String filename) {
        if (text == null || text.isBlank()) {
            return new Detection(UNKNOWN, 0.0);
        }
        String body = text.toLowerCase(Locale.ROOT);
        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);

        String bestType = UNKNOWN;
        double bestScore = 0.0;
        double total = 0.0;
        for (Map.Entry<String, Patterns> entry : PATTERNS.entrySet()) {
            double score = 0.0;
            for (String keyword : entry.getValue().keywords()) {
                if (body.contains(keyword)) {
                    score += 1.0;
                }
                if (name.contains(keyword)) {
                    score += 0.5;
                }
            }
            for (String phrase : entry.getValue().phrases()) {
                if (body.contains(phrase)) {
                    score += 2.0;
                }
            }
            total += score;
            if (score > bestScore) {
                bestScore = score;
                bestType = entry.getKey();
            }
        }

        if (bestScore == 0.0) {
            return new Detection(UNKNOWN, 0.0);
        }
        double confidence = Math.min(bestScore / Math.max(total, 1.0), 1.0);
        return confidence < MIN_CONFIDENCE ? new Detection(UNKNOWN, confidence) : new Detection(bestType, confidence);
    }
}
