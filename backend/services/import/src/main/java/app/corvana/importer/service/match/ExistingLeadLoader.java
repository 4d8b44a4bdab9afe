package app.corvana.importer.service.match;

import app.corvana.importer.client.core.CoreApiClient;
import app.corvana.importer.client.core.CoreLeadResponse;
import app.corvana.importer.client.core.CorePageResponse;
import app.corvana.importer.config.ImportProps;
import app.corvana.importer.service.ImportScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the workspace's leads page by page, keeping the order the core service returns them in.
 */
@Component
public class ExistingLeadLoader {

    private static final Logger log = LoggerFactory.getLogger(ExistingLeadLoader.class);

    private final CoreApiClient coreApiClient;
    private final ImportProps props;

    public ExistingLeadLoader(CoreApiClient coreApiClient, ImportProps props) {
        this.coreApiClient = coreApiClient;
        this.props = props;
    }

    public List<CoreLeadResponse> loadAll(ImportScope scope) {
        int pageSize = props.leadPageSize();
        int max = props.maxExistingLeads();
        List<CoreLeadResponse> leads = new ArrayList<>();
        int page = 1;
        while (leads.size() < max) {
            CorePageResponse<CoreLeadResponse> response =
                    coreApiClient.getLeads(scope.accessToken(), scope.workspaceId(), page, pageSize);
            if (response == null || response.items() == null || response.items().isEmpty()) {
                break;
            }
            for (CoreLeadResponse lead : response.items()) {
                if (lead == null || lead.id() == null) {
                    continue;
                }
                leads.add(lead);
                if (leads.size() >= max) {
                    log.warn("Workspace {} has more than {} leads, matching against the first {} only",
                            scope.workspaceId(), max, max);
                    break;
                }
            }
            // the core service may cap the page size below ours, so only hasMore ends the listing
            if (!response.hasMore()) {
                break;
            }
            page++;
        }
        return leads;
    }
}
