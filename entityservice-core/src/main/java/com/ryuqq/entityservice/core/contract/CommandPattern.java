package com.ryuqq.entityservice.core.contract;

import com.ryuqq.entityservice.core.model.EntityKind;
import com.ryuqq.entityservice.core.model.Payload;

/**
 * 와이어 패턴(create_post, get_posts, ...)을 {@link Command}로 해석합니다.
 *
 * <p>get_posts(복수형)는 READ_ALL, get_post(단수형)는 READ_ONE으로 해석합니다.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class CommandPattern {

    private CommandPattern() {
        // utility class
    }

    /**
     * 와이어 패턴과 페이로드로 Command 생성.
     *
     * @param pattern 와이어 패턴 (예: create_post)
     * @param payload 페이로드 (null 가능)
     * @return Command 인스턴스
     * @throws IllegalArgumentException 해석할 수 없는 패턴인 경우
     */
    public static Command parse(String pattern, Payload payload) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern cannot be null or blank");
        }
        int separator = pattern.indexOf('_');
        if (separator <= 0 || separator == pattern.length() - 1) {
            throw new IllegalArgumentException("pattern must look like <verb>_<kind>: " + pattern);
        }

        String verb = pattern.substring(0, separator);
        String target = pattern.substring(separator + 1);

        return switch (verb) {
            case "create" -> Command.of(CommandName.CREATE, EntityKind.of(target), payload);
            case "update" -> Command.of(CommandName.UPDATE, EntityKind.of(target), payload);
            case "delete" -> Command.of(CommandName.DELETE, EntityKind.of(target), payload);
            case "get" -> parseRead(target, payload);
            default -> throw new IllegalArgumentException("Unknown command verb: " + verb);
        };
    }

    private static Command parseRead(String target, Payload payload) {
        if (target.length() > 1 && target.endsWith("s")) {
            return Command.of(CommandName.READ_ALL, EntityKind.of(target.substring(0, target.length() - 1)), payload);
        }
        return Command.of(CommandName.READ_ONE, EntityKind.of(target), payload);
    }
}
