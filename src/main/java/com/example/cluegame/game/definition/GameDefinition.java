package com.example.cluegame.game.definition;

import com.example.cluegame.game.domain.AgentType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * 게임 정의 파일(JSON) 형식
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GameDefinition(
        String name,
        List<String> suspects,
        List<String> weapons,
        List<String> rooms,
        String accusationRoom,
        Boolean aiOnly,
        String firstPlayer,
        BoardDefinition board,
        List<PlayerDefinition> players,
        EnvelopeDefinition envelope
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BoardDefinition(
            List<String> spaces,
            List<List<String>> edges,
            List<List<String>> passages
    ) {
    }

    /**
     * @param hand 비어 있으면 로더가 무작위로 나눠준다
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlayerDefinition(
            String suspect,
            AgentType agent,
            String start,
            List<String> hand
    ) {
    }

    public record EnvelopeDefinition(String suspect, String weapon, String room) {
    }
}
