package com.example.cluegame.game.board;

import com.example.cluegame.game.domain.AgentType;
import com.example.cluegame.game.domain.GameState;
import com.example.cluegame.game.domain.Players;
import com.example.cluegame.game.domain.PublicState;
import com.example.cluegame.game.domain.board.Location;
import com.example.cluegame.game.domain.board.Move;
import com.example.cluegame.game.domain.board.MovementOption;
import com.example.cluegame.game.domain.card.CardTriple;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.cluegame.support.TestCards.ACCUSATION_ROOM;
import static com.example.cluegame.support.TestCards.CELLAR;
import static com.example.cluegame.support.TestCards.GREEN;
import static com.example.cluegame.support.TestCards.LIBRARY;
import static com.example.cluegame.support.TestCards.PIPE;
import static com.example.cluegame.support.TestCards.player;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphBoardTest {

    private static final Location S1 = Location.space("s1");
    private static final Location S2 = Location.space("s2");
    private static final Location S3 = Location.space("s3");
    private static final Location LIBRARY_ROOM = Location.room("Library");
    private static final Location KITCHEN_ROOM = Location.room("Kitchen");
    private static final Location HALL_ROOM = Location.room("Hall");

    // s1 - s2 - s3 한 줄 복도, Library는 s1, Kitchen은 s1과 s3, Hall은 s3에 붙어 있다
    private final GraphBoard board = GraphBoard.builder()
            .edge(S1, S2)
            .edge(S2, S3)
            .edge(LIBRARY_ROOM, S1)
            .edge(KITCHEN_ROOM, S1)
            .edge(KITCHEN_ROOM, S3)
            .edge(HALL_ROOM, S3)
            .edge(CELLAR, S2)
            .passage(LIBRARY_ROOM, HALL_ROOM)
            .build();

    private static GameState standingAt(Location location) {
        return new GameState(
                Players.of(List.of(player("Red", AgentType.AI, location))),
                new PublicState("Red", ACCUSATION_ROOM, true),
                new CardTriple(GREEN, PIPE, LIBRARY));
    }

    @Test
    @DisplayName("방에서는 주사위와 비밀 통로, 복도에서는 주사위만")
    void moveOptions() {
        assertThat(board.getMoveOptions(standingAt(LIBRARY_ROOM)))
                .containsExactly(Move.roll(), Move.passage(HALL_ROOM));
        assertThat(board.getMoveOptions(standingAt(HALL_ROOM)))
                .containsExactly(Move.roll(), Move.passage(LIBRARY_ROOM));
        assertThat(board.getMoveOptions(standingAt(S2))).containsExactly(Move.roll());
    }

    @Test
    @DisplayName("주사위 눈 이내의 방은 모두 후보, 복도 칸은 정확한 거리만 후보")
    void movementOptionsFromSpace() {
        List<MovementOption> options = board.getMovementOptions(standingAt(S1), 2);

        assertThat(options).containsExactlyInAnyOrder(
                new MovementOption(LIBRARY_ROOM, false),
                new MovementOption(KITCHEN_ROOM, false),
                new MovementOption(CELLAR, true),
                new MovementOption(S3, true));
    }

    @Test
    @DisplayName("방을 지나서 이동할 수 없다")
    void roomsBlockPaths() {
        GraphBoard corridor = GraphBoard.builder()
                .edge(S1, LIBRARY_ROOM)
                .edge(LIBRARY_ROOM, S2)
                .build();

        List<MovementOption> options = corridor.getMovementOptions(standingAt(S1), 2);

        assertThat(options).containsExactly(new MovementOption(LIBRARY_ROOM, false));
    }

    @Test
    @DisplayName("방에서 출발하면 문으로 나가서 이동한다")
    void leavesStartingRoom() {
        List<MovementOption> options = board.getMovementOptions(standingAt(HALL_ROOM), 2);

        assertThat(options).extracting(MovementOption::location)
                .containsExactlyInAnyOrder(KITCHEN_ROOM, S2)
                .doesNotContain(HALL_ROOM);
    }

    @Test
    @DisplayName("갈 곳이 없으면 제자리에 머문다")
    void staysWhenNothingReachable() {
        GraphBoard isolated = GraphBoard.builder().location(S1).build();

        assertThat(isolated.getMovementOptions(standingAt(S1), 4))
                .containsExactly(new MovementOption(S1, false));
    }

    @Test
    @DisplayName("고발 방밖에 갈 곳이 없으면 제자리도 후보에 들어간다")
    void staysWhenOnlyAccusationRoomReachable() {
        GraphBoard deadEnd = GraphBoard.builder().edge(S1, CELLAR).build();

        assertThat(deadEnd.getMovementOptions(standingAt(S1), 2))
                .containsExactly(new MovementOption(CELLAR, false), new MovementOption(S1, false));
    }

    @Test
    @DisplayName("비밀 통로는 방끼리만 연결할 수 있다")
    void passageRequiresRooms() {
        assertThatThrownBy(() -> GraphBoard.builder().passage(S1, LIBRARY_ROOM))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
