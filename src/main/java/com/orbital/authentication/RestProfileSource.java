package com.orbital.authentication;

import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.util.JSONObjectUtils;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.Objects;

import static com.orbital.authentication.IdentityAuthorityHelper.AUTHORIZATION;

/**
 * Fetches profiles from an HTTP service that serves a JSON object per subject at
 * <code>{base}/{subjectId}</code>. Requests carry the access token of the locally held session.
 * Give the client a {@link ProfileRequestAuthenticator} so an expired token is refreshed once.
 */
@Slf4j
public class RestProfileSource implements ProfileSource {

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final LocalSessionStore sessionStore;

    public RestProfileSource(OkHttpClient httpClient, HttpUrl baseUrl, LocalSessionStore sessionStore) {
        Objects.requireNonNull(httpClient, "Must provide an http client for the profile source");
        Objects.requireNonNull(baseUrl, "Must provide a base URL for the profile source");
        Objects.requireNonNull(sessionStore, "Must provide a local session store for the profile source");
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.sessionStore = sessionStore;
    }

    @Override
    public Profile fetch(String subjectId) throws IOException {
        Objects.requireNonNull(subjectId, "Must provide a subject identifier to fetch a profile for");
        Request.Builder requestBuilder = new Request.Builder().url(this.baseUrl.newBuilder().addPathSegment(subjectId).build()).get();
        Session session = this.sessionStore.get();
        if (session != null) { requestBuilder.header(AUTHORIZATION, "Bearer " + session.getAccessToken().getValue()); }
        try (Response response = this.httpClient.newCall(requestBuilder.build()).execute()) {
            if (!response.isSuccessful()) { throw new IOException("Profile request for " + subjectId + " failed with status " + response.code()); }
            ResponseBody body = response.body();
            if (body == null) { throw new IOException("Profile response for " + subjectId + " has no body"); }
            return new Profile(subjectId, JSONObjectUtils.parse(body.string()));
        } catch (ParseException ex) {
            throw new IOException("Failed to parse profile for " + subjectId, ex);
        }
    }

}
