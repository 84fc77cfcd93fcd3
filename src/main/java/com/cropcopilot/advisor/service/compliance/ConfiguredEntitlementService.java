package com.cropcopilot.advisor.service.compliance;

import com.cropcopilot.advisor.configuration.AppProperties;
import com.cropcopilot.advisor.configuration.ComplianceProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Entitlement from configuration: users listed under
 * {@code app.compliance.entitled-users} are entitled, everyone else gets the
 * {@code entitled-by-default} answer.
 */
@Service
@RequiredArgsConstructor
public class ConfiguredEntitlementService implements EntitlementService {

    private final AppProperties props;

    @Override
    public boolean isEntitled(String userId) {
        ComplianceProperties compliance = props.getCompliance();
        if (userId != null && compliance.getEntitledUsers().contains(userId)) {
            return true;
        }
        return compliance.isEntitledByDefault();
    }
}
