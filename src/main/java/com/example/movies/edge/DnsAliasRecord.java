package com.example.movies.edge;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * Alias record from the public hostname to the router's endpoint host. The target is a name,
 * never an address, so the endpoint can move without a DNS change.
 */
@Value
public class DnsAliasRecord {

    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    String hostname;
    String targetDomainName;
    String hostedZoneId;

    public DnsAliasRecord(String hostname, String targetDomainName, String hostedZoneId) {
        if (targetDomainName == null || targetDomainName.isEmpty()) {
            throw new DomainBindingException("Alias for " + hostname + " has no target");
        }
        if (IPV4.matcher(targetDomainName).matches() || targetDomainName.contains(":")) {
            throw new DomainBindingException("Alias target must be a hostname, not an address: " + targetDomainName);
        }
        this.hostname = hostname;
        this.targetDomainName = targetDomainName;
        this.hostedZoneId = hostedZoneId;
    }
}
