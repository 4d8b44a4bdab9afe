package app.corvana.importer.client.core;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Component
public class CoreApiClient {

    private final RestClient restClient;

    public CoreApiClient(RestClient coreRestClient) {
        this.restClient = coreRestClient;
    }

    public List<CoreTransactionResponse> getTransactions(String accessToken,
                                                         UUID workspaceId,
                                                         UUID accountId,
                                                         LocalDate from,
                                                         LocalDate to) {
        List<CoreTransactionResponse> response = restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/workspaces/{workspaceId}/accounts/{accountId}/transactions")
                        .queryParam("from", from)
                        .queryParam("to", to)
                        .build(workspaceId, accountId))
                .header(HttpHeaders.AUTHORIZATION, bearer(accessToken))
                .retrieve()
                .body(new ParameterizedTypeReference<List<CoreTransactionResponse>>() {});
        return response == null ? List.of() : response;
    }

    public CorePageResponse<CoreLeadResponse> getLeads(String accessToken, UUID workspaceId, int page, int limit) {
        return restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/workspaces/{workspaceId}/leads")
                        .queryParam("page", page)
                        .queryParam("limit", limit)
                        .build(workspaceId))
                .header(HttpHeaders.AUTHORIZATION, bearer(accessToken))
                .retrieve()
                .body(new ParameterizedTypeReference<CorePageResponse<CoreLeadResponse>>() {});
    }

    public CoreBatchResponse createTransactionsBatch(String accessToken, UUID workspaceId, List<CoreTransactionRequest> requests) {
        return postBatch(accessToken, workspaceId, "transactions", requests);
    }

    public CoreBatchResponse createLeadsBatch(String accessToken, UUID workspaceId, List<CoreLeadRequest> requests) {
        return postBatch(accessToken, workspaceId, "leads", requests);
    }

    public CoreBatchResponse createContactsBatch(String accessToken, UUID workspaceId, List<CoreContactRequest> requests) {
        return postBatch(accessToken, workspaceId, "contacts", requests);
    }

    public CoreBatchResponse createOpportunitiesBatch(String accessToken, UUID workspaceId, List<CoreOpportunityRequest> requests) {
        return postBatch(accessToken, workspaceId, "opportunities", requests);
    }

    public CoreBatchResponse createTasksBatch(String accessToken, UUID workspaceId, List<CoreTaskRequest> requests) {
        return postBatch(accessToken, workspaceId, "tasks", requests);
    }

    private CoreBatchResponse postBatch(String accessToken, UUID workspaceId, String collection, List<?> requests) {
        CoreBatchResponse response = restClient.post()
                .uri("/workspaces/{workspaceId}/{collection}/batch", workspaceId, collection)
                .header(HttpHeaders.AUTHORIZATION, bearer(accessToken))
                .body(requests)
                .retrieve()
                .body(CoreBatchResponse.class);
        return response == null ? new CoreBatchResponse(List.of(), List.of()) : response;
    }

    private String bearer(String token) {
        return "Bearer " + token;
    }
}
