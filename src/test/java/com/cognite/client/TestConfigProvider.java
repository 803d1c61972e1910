package com.cognite.client;

import com.google.common.base.Strings;

public class TestConfigProvider {
    protected static String rawDbName = "the_best_tests";
    protected static String rawTableName = "best_table";

    protected static String getProject() {
        String project = System.getenv("TEST_PROJECT");

        if (Strings.isNullOrEmpty(project)) {
            project = "test";
        }

        return project;
    }

    protected static String getApiKey() {
        String apiKey = System.getenv("TEST_KEY");

        if (Strings.isNullOrEmpty(apiKey)) {
            apiKey = "test";
        }

        return apiKey;
    }

    public static String getClientId() {
        String clientId = System.getenv("TEST_CLIENT_ID");

        if (Strings.isNullOrEmpty(clientId)) {
            clientId = "default";
        }
        return clientId;
    }

    public static String getClientSecret() {
        String clientSecret = System.getenv("TEST_CLIENT_SECRET");

        if (Strings.isNullOrEmpty(clientSecret)) {
            clientSecret = "default";
        }
        return clientSecret;
    }

    public static String getTokenUrl() {
        String tokenUrl = System.getenv("TEST_TOKEN_URL");

        if (Strings.isNullOrEmpty(tokenUrl)) {
            tokenUrl = "http://localhost:4567/token";
        }
        return tokenUrl;
    }

    protected static String getHost() {
        String host = System.getenv("TEST_HOST");

        if (Strings.isNullOrEmpty(host)) {
            host = "http://localhost:4567";
        }
        return host;
    }
}
