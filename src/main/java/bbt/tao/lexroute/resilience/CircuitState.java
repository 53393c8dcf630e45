package bbt.tao.lexroute.resilience;

public enum CircuitState {
    CLOSED,     // вызовы проходят, ошибки считаются
    OPEN,       // вызовы отклоняются до истечения reset-timeout
    HALF_OPEN   // пропускается ровно один пробный вызов
}
