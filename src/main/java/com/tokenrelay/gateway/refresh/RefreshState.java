package com.tokenrelay.gateway.refresh;

/**
 * 刷新周期状态
 * <p>
 * ABANDONED：刷新在途时会话被登出或重新登录，刷新结果到达后直接丢弃
 */
public enum RefreshState {
    IDLE,
    IN_FLIGHT,
    SUCCEEDED,
    FAILED,
    ABANDONED;

    public boolean isSettled() {
        return this != IDLE && this != IN_FLIGHT;
    }
}
