package bbt.tao.lexroute.service.llm;

/**
 * Одно сообщение диалога, передаваемое генерирующему бэкенду.
 */
public record ChatTurn(Role role, String content) {

    public enum Role { SYSTEM, USER, ASSISTANT }

    public static ChatTurn system(String content) {
        return new ChatTurn(Role.SYSTEM, content);
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(Role.USER, content);
    }
}
