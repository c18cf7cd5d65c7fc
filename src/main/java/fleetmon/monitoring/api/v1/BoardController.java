package fleetmon.monitoring.api.v1;

import fleetmon.monitoring.api.Controller;
import fleetmon.monitoring.api.v1.dto.BoardInfoResponse;
import fleetmon.monitoring.service.MonitoringService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;
import java.util.Map;

/**
 * Controller for board aggregates.
 * GET /api/v1/boards - List all boards
 * GET /api/v1/boards/{id} - One board
 */
public class BoardController implements Controller {

    private static final String BASE = "/api/v1/boards";
    private static final String ITEM_PREFIX = BASE + "/";

    private final MonitoringService service;

    public BoardController(MonitoringService service) {
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && (BASE.equals(path) || Controller.isItemPath(path, ITEM_PREFIX));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (BASE.equals(path)) {
            List<BoardInfoResponse> boards = service.allBoards().stream()
                    .map(BoardInfoResponse::from)
                    .toList();
            return ControllerResponse.ofJson(Map.of("boards", boards));
        }

        String boardId = QueryStringDecoder.decodeComponent(path.substring(ITEM_PREFIX.length()));
        return service.findBoard(boardId)
                .map(board -> ControllerResponse.ofJson(BoardInfoResponse.from(board)))
                .orElseGet(() -> ControllerResponse.notFound("board not found: " + boardId));
    }
}
