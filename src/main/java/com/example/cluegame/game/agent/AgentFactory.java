package com.example.cluegame.game.agent;

import com.example.cluegame.game.domain.AgentType;
import com.example.cluegame.game.domain.GamePlayerState;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 플레이어 종류에 맞는 전략을 제공하는 Factory
 */
@Component
public class AgentFactory {

    private final Map<AgentType, PlayerAgent> agentMap = new EnumMap<>(AgentType.class);

    public AgentFactory(List<PlayerAgent> agents) {
        for (PlayerAgent agent : agents) {
            agentMap.put(agent.getAgentType(), agent);
        }
    }

    /**
     * 플레이어 종류에 해당하는 전략 반환
     *
     * @throws IllegalArgumentException 등록되지 않은 종류인 경우
     */
    public PlayerAgent getAgent(AgentType type) {
        PlayerAgent agent = agentMap.get(type);
        if (agent == null) {
            throw new IllegalArgumentException("지원하지 않는 플레이어 종류: " + type);
        }
        return agent;
    }

    public PlayerAgent getAgent(GamePlayerState player) {
        return getAgent(player.getAgentType());
    }
}
