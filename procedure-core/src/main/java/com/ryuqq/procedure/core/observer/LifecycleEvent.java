package com.ryuqq.procedure.core.observer;

/**
 * 관찰자가 바인딩되는 생명주기 이벤트.
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public enum LifecycleEvent {

    /**
     * execute() 직전. 이 이벤트의 관찰자가 모두 끝난 뒤에 실행 본문이 시작됩니다.
     */
    WILL_EXECUTE,

    /**
     * execute() 반환 직후.
     */
    DID_EXECUTE,

    /**
     * 종료 처리 시작. 이 이벤트의 관찰자가 모두 끝난 뒤에 FINISHED가 됩니다.
     */
    WILL_FINISH,

    /**
     * 종료 완료. 오류 목록이 동결된 이후에만 호출됩니다.
     */
    DID_FINISH,

    /**
     * 최초 취소 요청.
     */
    DID_CANCEL
}
