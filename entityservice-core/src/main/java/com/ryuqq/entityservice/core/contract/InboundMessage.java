package com.ryuqq.entityservice.core.contract;

/**
 * 인박스에서 꺼낸 수신 메시지.
 *
 * <p>명령(응답 필요)이거나 이벤트(응답 없음) 중 하나입니다.
 * 명령은 응답을 되돌려 보내기 위한 correlationId를 가집니다.</p>
 *
 * @param correlationId 요청-응답 상관 ID (이벤트인 경우 null)
 * @param command 명령 (이벤트인 경우 null)
 * @param event 이벤트 (명령인 경우 null)
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record InboundMessage(
    String correlationId,
    Command command,
    EventMessage event
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 명령과 이벤트가 동시에 있거나 둘 다 없는 경우,
     *                                  또는 명령에 correlationId가 없는 경우
     */
    public InboundMessage {
        if ((command == null) == (event == null)) {
            throw new IllegalArgumentException("exactly one of command or event must be present");
        }
        if (command != null && (correlationId == null || correlationId.isBlank())) {
            throw new IllegalArgumentException("correlationId cannot be null or blank for a command");
        }
    }

    /**
     * 명령 메시지 생성.
     *
     * @param correlationId 상관 ID
     * @param command 명령
     * @return InboundMessage 인스턴스
     */
    public static InboundMessage ofCommand(String correlationId, Command command) {
        return new InboundMessage(correlationId, command, null);
    }

    /**
     * 이벤트 메시지 생성.
     *
     * @param event 이벤트
     * @return InboundMessage 인스턴스
     */
    public static InboundMessage ofEvent(EventMessage event) {
        return new InboundMessage(null, null, event);
    }

    /**
     * 명령 메시지 여부.
     *
     * @return 명령이면 true
     */
    public boolean isCommand() {
        return command != null;
    }
}
