package com.example.cluegame.game.domain;

import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.sheet.KnowledgeSheet;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

@Getter
@With
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString(exclude = "sheet")
public class GamePlayerState {
    // 용의자 이름이 곧 플레이어 id
    private final String suspect;

    private final AgentType agentType;

    private final Location location;

    @Builder.Default
    private final boolean out = false;

    private final KnowledgeSheet sheet;

    public boolean isHuman() {
        return agentType == AgentType.HUMAN;
    }

    public boolean isActiveHuman() {
        return !out && isHuman();
    }
}
