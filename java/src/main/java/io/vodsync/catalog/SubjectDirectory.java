package io.vodsync.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import io.vodsync.DataShapeException;
import io.vodsync.VodSyncException;
import io.vodsync.auth.Session;
import io.vodsync.internal.HttpUtil;
import io.vodsync.internal.ResponseDecoder;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Lists the subjects pinned in the Canvas "Courses" sidebar.
 */
public final class SubjectDirectory {

    private static final Logger LOGGER = Logger.getLogger(SubjectDirectory.class.getName());

    static final String FAVORITES_PATH = "/api/v1/users/self/favorites/courses";

    // TODO: follow the Link header once a user has more favourites than Canvas returns on one page
    public List<Subject> list(Session session) throws VodSyncException {
        HttpRequest request = session.request(session.config().getCanvasBaseUrl() + FAVORITES_PATH)
            .header("Accept", "application/json")
            .GET()
            .build();
        HttpResponse<byte[]> response = HttpUtil.sendChecked(session.client(), request, "list subjects");
        JsonNode root = ResponseDecoder.readJson(response, "decode subject list");
        if (!root.isArray()) {
            throw new DataShapeException("subject list is not an array: " + root);
        }

        List<Subject> subjects = new ArrayList<>();
        for (JsonNode node : root) {
            JsonNode account = node.path("account_id");
            subjects.add(new Subject(
                node.path("id").asLong(),
                node.path("name").asText(""),
                account.isNumber() ? account.asLong() : null));
        }
        LOGGER.info(() -> "[vod-sync] " + subjects.size() + " subjects listed");
        return subjects;
    }
}
