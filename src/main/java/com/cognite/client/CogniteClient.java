/*
 * Copyright (c) 2020 Cognite AS
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.cognite.client;

import com.cognite.client.config.ApiKeyCredentials;
import com.cognite.client.config.AuthConfig;
import com.cognite.client.config.ClientConfig;
import com.cognite.client.config.CredentialProvider;
import com.cognite.client.config.OAuthClientCredentials;
import com.cognite.client.config.TokenCredentials;
import com.cognite.client.dto.LoginStatus;
import com.cognite.client.servicesV1.ConnectorServiceV1;
import com.cognite.client.util.PriorityThreadPoolExecutor;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.Serializable;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * This class represents the main entry point for interacting with this SDK (and Cognite Data Fusion).
 *
 * All services are exposed via this object.
 */
@AutoValue
public abstract class CogniteClient implements Serializable {
    private final static String DEFAULT_BASE_URL = "https://api.cognitedata.com";
    private final static String API_ENV_VAR = "COGNITE_API_KEY";

    private final static OkHttpClient httpClient = new OkHttpClient.Builder()
            .connectTimeout(90, TimeUnit.SECONDS)
            .readTimeout(90, TimeUnit.SECONDS)
            .writeTimeout(90, TimeUnit.SECONDS)
            .build();

    // Runs the async api requests.
    private static ForkJoinPool executorService = new ForkJoinPool(ClientConfig.create().getNoWorkers());
    // Runs the write and delete tasks.
    private static final PriorityThreadPoolExecutor taskExecutor =
            new PriorityThreadPoolExecutor(ClientConfig.create().getNoWorkers());
    // Runs the partition readers of concurrent list requests.
    private static final ThreadPoolExecutor partitionExecutor =
            newPartitionExecutor(ClientConfig.create().getNoWorkers());

    protected final Logger LOG = LoggerFactory.getLogger(this.getClass());

    @Nullable
    private String cdfProjectCache = null; // Cache attribute for the CDF project

    private static Builder builder() {
        return new AutoValue_CogniteClient.Builder()
                .setClientConfig(ClientConfig.create())
                .setBaseUrl(DEFAULT_BASE_URL);
    }

    /**
     * Returns a {@link CogniteClient} using an API key from the system's environment
     * variables (COGNITE_API_KEY) and using default settings.
     * @return the client object.
     * @throws Exception if the api key cannot be read from the system environment.
     */
    public static CogniteClient create() throws Exception {
        String apiKey = System.getenv(API_ENV_VAR);
        if (null == apiKey) {
            String errorMessage = "The environment variable " + API_ENV_VAR + " is not set. Either provide "
                    + "an api key directly to the client or set it via " + API_ENV_VAR;
            throw new Exception(errorMessage);
        }

        return CogniteClient.ofKey(apiKey);
    }

    /**
     * Returns a {@link CogniteClient} authenticating with an api key.
     *
     * If no project is set, the project is looked up from the api key on first use.
     *
     * @param apiKey The api key.
     * @return the client object.
     */
    public static CogniteClient ofKey(String apiKey) {
        return CogniteClient.builder()
                .setCredentials(ApiKeyCredentials.of(apiKey))
                .build();
    }

    /**
     * Returns a {@link CogniteClient} authenticating with a static bearer token. You must also specify the project
     * via {@link #withProject(String)}.
     *
     * @param token The bearer token.
     * @return the client object.
     */
    public static CogniteClient ofToken(String token) {
        return CogniteClient.builder()
                .setCredentials(TokenCredentials.of(token))
                .build();
    }

    /**
     * Returns a {@link CogniteClient} authenticating with bearer tokens from a supplier. The supplier is called
     * for each request. You must also specify the project via {@link #withProject(String)}.
     *
     * @param tokenSupplier Supplies the current bearer token.
     * @return the client object.
     */
    public static CogniteClient ofToken(Supplier<String> tokenSupplier) {
        return CogniteClient.builder()
                .setCredentials(TokenCredentials.of(tokenSupplier))
                .build();
    }

    /**
     * Returns a {@link CogniteClient} authenticating via the OAuth 2.0 client credentials flow. You must also
     * specify the project via {@link #withProject(String)}.
     *
     * @param clientId The client id.
     * @param clientSecret The client secret.
     * @param tokenUrl The token endpoint of the identity provider.
     * @param scopes The scopes to request.
     * @return the client object.
     */
    public static CogniteClient ofClientCredentials(String clientId,
                                                    String clientSecret,
                                                    String tokenUrl,
                                                    List<String> scopes) {
        return CogniteClient.builder()
                .setCredentials(OAuthClientCredentials.of(clientId, clientSecret, tokenUrl, scopes)
                        .withHttpClient(httpClient))
                .build();
    }

    protected abstract Builder toBuilder();
    @Nullable
    public abstract CredentialProvider getCredentials();
    @Nullable
    public abstract String getProject();
    public abstract String getBaseUrl();
    public abstract ClientConfig getClientConfig();

    protected OkHttpClient getHttpClient() {
        return httpClient;
    }

    protected ForkJoinPool getExecutorService() {
        return executorService;
    }

    protected PriorityThreadPoolExecutor getTaskExecutor() {
        return taskExecutor;
    }

    protected ThreadPoolExecutor getPartitionExecutor() {
        return partitionExecutor;
    }

    /**
     * Returns a {@link CogniteClient} using the specified credentials.
     *
     * @param credentials The credentials to authenticate the api requests with.
     * @return the client object with the credentials set.
     */
    public CogniteClient withCredentials(CredentialProvider credentials) {
        Preconditions.checkNotNull(credentials, "The credentials cannot be null.");
        return toBuilder().setCredentials(credentials).build();
    }

    /**
     * Returns a {@link CogniteClient} using the specified Cognite Data Fusion project / tenant.
     *
     * @param project The project / tenant to use for interacting with Cognite Data Fusion.
     * @return the client object with the project / tenant key set.
     */
    public CogniteClient withProject(String project) {
        Preconditions.checkArgument(null != project && !project.isEmpty(),
                "The project cannot be empty.");
        return toBuilder().setProject(project).build();
    }

    /**
     * Returns a {@link CogniteClient} using the specified base URL for issuing API requests.
     *
     * The base URL must follow the format {@code https://<my-host>.cognitedata.com}. The default
     * base URL is {@code https://api.cognitedata.com}
     *
     * @param baseUrl The CDF api base URL
     * @return the client object with the base URL set.
     */
    public CogniteClient withBaseUrl(String baseUrl) {
        Preconditions.checkArgument(null != baseUrl && !baseUrl.isEmpty(),
                "The base URL cannot be empty.");
        return toBuilder().setBaseUrl(baseUrl).build();
    }

    /**
     * Returns a {@link CogniteClient} using the specified configuration settings.
     *
     * The worker pools are shared by all clients in the process, so the worker setting applies to all of them.
     *
     * @param config The {@link ClientConfig} hosting the client configuration setting.
     * @return the client object with the config applied.
     */
    public CogniteClient withClientConfig(ClientConfig config) {
        Preconditions.checkNotNull(config, "The client config cannot be null.");
        // Modify the no threads in the executor services based on the config
        LOG.info("Setting up client with {} worker threads and {} list partitions",
                config.getNoWorkers(),
                config.getNoListPartitions());
        if (executorService.getParallelism() != config.getNoWorkers()) {
            executorService = new ForkJoinPool(config.getNoWorkers());
        }
        taskExecutor.resize(config.getNoWorkers());
        resizePartitionExecutor(config.getNoWorkers());

        return toBuilder().setClientConfig(config).build();
    }

    /**
     * Returns {@link Raw} representing the Cognite Raw api endpoints.
     *
     * @return The raw api object.
     */
    public Raw raw() {
        return Raw.of(this);
    }

    /**
     * Returns {@link Sessions} representing the Cognite sessions api endpoint.
     *
     * @return The sessions api object.
     */
    public Sessions sessions() {
        return Sessions.of(this);
    }

    /**
     * Returns the services layer mirroring the Cognite Data Fusion API.
     */
    protected ConnectorServiceV1 getConnectorService() {
        return ConnectorServiceV1.create(getClientConfig().getMaxRetries(),
                        getClientConfig().getAppIdentifier(),
                        getClientConfig().getSessionIdentifier())
                .withMaxRetryBackoff(getClientConfig().getMaxRetryBackoff())
                .withHttpClient(getHttpClient())
                .withExecutorService(getExecutorService());
    }

    /**
     * Returns the auth info for api requests.
     *
     * @return the auth config with host, project and credentials populated.
     * @throws Exception if the project cannot be resolved.
     */
    protected AuthConfig buildAuthConfig() throws Exception {
        Preconditions.checkState(null != getCredentials(),
                "No credentials are configured for the client.");
        String cdfProject = null;
        if (null != getProject()) {
            // The project is explicitly defined
            cdfProject = getProject();
        } else if (null != cdfProjectCache) {
            // The project info is cached
            cdfProject = cdfProjectCache;
        } else if (getCredentials() instanceof ApiKeyCredentials) {
            // Have to get the project via the api key
            LoginStatus loginStatus = getConnectorService()
                    .readLoginStatus(getBaseUrl(), getCredentials());

            if (loginStatus.getProject().isEmpty()) {
                throw new Exception("Could not find the project for the api key.");
            }
            LOG.debug("Project identified for the api key. Project: {}", loginStatus.getProject());
            cdfProjectCache = loginStatus.getProject(); // Cache the result
            cdfProject = loginStatus.getProject();
        } else {
            String message = "No project is configured for the client. Specify it via withProject().";
            LOG.error(message);
            throw new Exception(message);
        }

        return AuthConfig.create()
                .withHost(getBaseUrl())
                .withCredentials(getCredentials())
                .withProject(cdfProject);
    }

    private static ThreadPoolExecutor newPartitionExecutor(int maxWorkers) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(maxWorkers, maxWorkers, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder()
                        .setNameFormat("cognite-partition-%d")
                        .setDaemon(true)
                        .build());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    private static synchronized void resizePartitionExecutor(int maxWorkers) {
        if (maxWorkers > partitionExecutor.getMaximumPoolSize()) {
            partitionExecutor.setMaximumPoolSize(maxWorkers);
            partitionExecutor.setCorePoolSize(maxWorkers);
        } else {
            partitionExecutor.setCorePoolSize(maxWorkers);
            partitionExecutor.setMaximumPoolSize(maxWorkers);
        }
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setCredentials(CredentialProvider value);
        abstract Builder setProject(String value);
        abstract Builder setBaseUrl(String value);
        abstract Builder setClientConfig(ClientConfig value);

        abstract CogniteClient build();
    }
}
