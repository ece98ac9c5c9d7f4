package com.khartoum.launchpad.service;

import com.khartoum.launchpad.config.LaunchpadProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.route53.Route53Client;
import software.amazon.awssdk.services.route53.model.*;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class Route53Service {

    private final Route53Client route53Client;
    private final LaunchpadProperties properties;

    @Value("${aws.route53.hosted-zone-id:}")
    private String hostedZoneId;

    @Value("${aws.route53.change-poll-attempts:30}")
    private int changePollAttempts;

    @Value("${aws.route53.change-poll-interval-ms:10000}")
    private long changePollIntervalMs;

    /**
     * Creates/Updates a CNAME record pointing the hostname at the ingress load balancer.
     *
     * @param hostname e.g., "alice.red-bricks.app"
     */
    public void upsertCname(String hostname) {
        String fqdn = normalizeFqdn(hostname);
        String lbDnsName = getLoadBalancerDnsName();

        try {
            ChangeResourceRecordSetsRequest request = ChangeResourceRecordSetsRequest.builder()
                .hostedZoneId(hostedZoneId)
                .changeBatch(ChangeBatch.builder()
                    .comment("tenant launch " + hostname)
                    .changes(Change.builder()
                        .action(ChangeAction.UPSERT)
                        .resourceRecordSet(ResourceRecordSet.builder()
                            .name(fqdn)
                            .type(RRType.CNAME)
                            .ttl(300L)
                            .resourceRecords(ResourceRecord.builder()
                                .value(lbDnsName)
                                .build())
                            .build())
                        .build())
                    .build())
                .build();

            ChangeResourceRecordSetsResponse response = route53Client.changeResourceRecordSets(request);
            log.info("Upserted DNS record for {} -> {} : changeId={}", fqdn, lbDnsName, response.changeInfo().id());

            waitForDnsChange(response.changeInfo().id());

        } catch (InvalidChangeBatchException e) {
            log.error("Invalid change batch while upserting DNS record for {} -> {}", fqdn, lbDnsName, e);
            throw new IllegalStateException("Invalid DNS change for " + hostname + ": " + e.getMessage(), e);
        } catch (Route53Exception e) {
            log.error("Route53 error while upserting DNS record for {} -> {}", fqdn, lbDnsName, e);
            throw new IllegalStateException("DNS provider rejected " + hostname + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks if a CNAME record already exists for the hostname.
     */
    public boolean recordExists(String hostname) {
        return findCnameRecord(normalizeFqdn(hostname)).isPresent();
    }

    private Optional<ResourceRecordSet> findCnameRecord(String fqdn) {
        ListResourceRecordSetsRequest request = ListResourceRecordSetsRequest.builder()
            .hostedZoneId(hostedZoneId)
            .startRecordName(fqdn)
            .startRecordType(RRType.CNAME)
            .maxItems("1")
            .build();

        ListResourceRecordSetsResponse response = route53Client.listResourceRecordSets(request);

        return response.resourceRecordSets().stream()
            .filter(rrs -> normalizeFqdn(rrs.name()).equals(fqdn) && rrs.type() == RRType.CNAME)
            .findFirst();
    }

    private String getLoadBalancerDnsName() {
        String lbDns = properties.getDomains().getLoadBalancerDns();
        if (lbDns != null && !lbDns.isBlank()) {
            return lbDns.trim();
        }
        throw new IllegalStateException(
            "LoadBalancer DNS name not configured. Set launchpad.domains.load-balancer-dns");
    }

    private void waitForDnsChange(String changeId) {
        try {
            for (int attempt = 1; attempt <= changePollAttempts; attempt++) {
                GetChangeResponse response = route53Client.getChange(GetChangeRequest.builder().id(changeId).build());

                if (response.changeInfo().status() == ChangeStatus.INSYNC) {
                    log.info("DNS change INSYNC: {}", changeId);
                    return;
                }

                log.debug("Waiting for DNS change {} (attempt {}/{})", changeId, attempt, changePollAttempts);
                Thread.sleep(changePollIntervalMs);
            }

            // PENDING changes still propagate; the record is accepted at this point
            log.warn("DNS change {} did not reach INSYNC within {} attempts", changeId, changePollAttempts);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for DNS change " + changeId, e);
        }
    }

    /**
     * Normalize FQDN for Route53 comparisons (ensure trailing dot).
     */
    static String normalizeFqdn(String name) {
        String n = name == null ? "" : name.trim();
        if (n.isEmpty()) return n;
        return n.endsWith(".") ? n : n + ".";
    }
}
