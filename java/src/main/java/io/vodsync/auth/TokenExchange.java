package io.vodsync.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.vodsync.Config;
import io.vodsync.DataShapeException;
import io.vodsync.VodSyncException;
import io.vodsync.internal.HttpUtil;
import io.vodsync.internal.ResponseDecoder;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Exchanges an authenticated Canvas session for a video service token scoped to one subject by replaying what a
 * browser does after clicking the "Classroom Video" tool.
 *
 * <ol>
 *   <li>GET the LTI launch page of the subject and read its auto-submitting form.</li>
 *   <li>POST that form to the external tool, which answers with a second form.</li>
 *   <li>POST the second form without following redirects; the {@code Location} header carries a token id in its
 *       query string.</li>
 *   <li>Forward that query string to the token resolution endpoint.</li>
 * </ol>
 *
 * Each hop consumes the previous hop's response; there is no shortcut.
 */
public final class TokenExchange {

    private static final Logger LOGGER = Logger.getLogger(TokenExchange.class.getName());

    static final String LOGIN_FORM_ID = "login_form";
    static final String TOKEN_RESOLUTION_PATH = "/lti3/getAccessTokenByTokenId";

    /**
     * Runs the hop chain for one subject.
     *
     * @param session   authenticated Canvas session.
     * @param subjectId Canvas course id of the subject.
     * @return the token and the video service's id for the subject.
     * @throws TokenException     when Canvas wants a fresh login or the token endpoint rejects the exchange.
     * @throws DataShapeException when a hop's response lacks the form, header or field the next hop needs.
     * @throws VodSyncException   on transport failures.
     */
    public ResourceToken acquire(Session session, long subjectId) throws VodSyncException {
        Objects.requireNonNull(session, "session");
        Config config = session.config();

        String launchUrl = String.format(Locale.ROOT, "%s/courses/%d/external_tools/%d",
            config.getCanvasBaseUrl(), subjectId, config.getExternalToolId());
        LOGGER.fine(() -> "[vod-sync] launching LTI tool for subject " + subjectId);

        RedirectForm launch = followForm(session, session.request(launchUrl).GET().build(), "LTI launch");
        RedirectForm handshake = followForm(session, formPost(session, launch), "LTI handshake");

        HttpResponse<byte[]> redirect = HttpUtil.sendChecked(
            session.nonRedirectingClient(), formPost(session, handshake), "external tool login");
        Optional<String> location = redirect.headers().firstValue("Location");
        if (location.isEmpty() || location.get().isBlank()) {
            throw new DataShapeException(String.format(Locale.ROOT,
                "external tool login for subject %d returned status %d without a redirect Location header",
                subjectId, redirect.statusCode()));
        }
        String query = tokenQuery(location.get());

        HttpRequest resolve = session.request(config.getVideoBaseUrl() + TOKEN_RESOLUTION_PATH + "?" + query)
            .header("Accept", "application/json")
            .GET()
            .build();
        HttpResponse<byte[]> response = HttpUtil.sendChecked(session.client(), resolve, "resolve token id");
        ResourceToken token = parseToken(ResponseDecoder.readJson(response, "decode token response"));
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[vod-sync] subject %d mapped to video course %s", subjectId, token.canvasSubjectId()));
        return token;
    }

    private RedirectForm followForm(Session session, HttpRequest request, String action) throws VodSyncException {
        HttpResponse<byte[]> response = HttpUtil.sendChecked(session.client(), request, action);
        return parseForm(ResponseDecoder.text(response), response.uri().toString(), action);
    }

    private static HttpRequest formPost(Session session, RedirectForm form) {
        return session.request(form.action())
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(HttpUtil.formEncode(form.multiValued())))
            .build();
    }

    static RedirectForm parseForm(String html, String pageUrl, String action) throws VodSyncException {
        Document document = Jsoup.parse(html, pageUrl);
        Element form = document.selectFirst("form");
        if (form == null) {
            throw new DataShapeException(action + ": response from " + pageUrl + " contains no form");
        }
        String id = form.id();
        if (LOGIN_FORM_ID.equals(id)) {
            throw new TokenException(TokenException.Reason.SESSION_EXPIRED,
                "Canvas session expired; log in again");
        }
        String target = form.absUrl("action");
        if (target.isEmpty()) {
            throw new DataShapeException(action + ": form on " + pageUrl + " has no action");
        }
        Map<String, String> fields = new LinkedHashMap<>();
        for (Element input : form.select("input[name]")) {
            fields.put(input.attr("name"), input.attr("value"));
        }
        return new RedirectForm(id, target, fields);
    }

    static String tokenQuery(String location) throws DataShapeException {
        int start = location.indexOf('?');
        if (start < 0 || start == location.length() - 1) {
            throw new DataShapeException("redirect location carries no query string: " + location);
        }
        String query = location.substring(start + 1);
        int fragment = query.indexOf('#');
        return fragment < 0 ? query : query.substring(0, fragment);
    }

    static ResourceToken parseToken(JsonNode response) throws VodSyncException {
        JsonNode code = response.path("code");
        if (code.isMissingNode() || code.isNull()) {
            throw new DataShapeException("token response has no code: " + response);
        }
        int value;
        try {
            value = Integer.parseInt(code.asText().trim());
        } catch (NumberFormatException ex) {
            throw new DataShapeException("token response code is not numeric: " + response, ex);
        }
        if (value != 0) {
            String message = response.path("message").asText("Unknown error");
            throw new TokenException(TokenException.Reason.REJECTED, message);
        }
        JsonNode data = response.path("data");
        String token = data.path("token").asText("");
        String courId = data.path("params").path("courId").asText("");
        if (token.isBlank() || courId.isBlank()) {
            throw new DataShapeException("token response lacks data.token or data.params.courId");
        }
        return new ResourceToken(token, courId);
    }
}
