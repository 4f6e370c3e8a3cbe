package io.github.wphillipmoore.edgegrid.siteshield;

import io.github.wphillipmoore.edgegrid.json.OmitEmpty;
import java.util.List;

/**
 * A Site Shield map: the CIDR blocks that may reach an origin.
 *
 * @param acknowledged whether the proposed CIDRs were acknowledged
 * @param contacts notification contacts
 * @param currentCidrs CIDR blocks in effect
 * @param proposedCidrs CIDR blocks awaiting acknowledgement
 * @param ruleName the map's rule name
 * @param type the map type
 * @param service the service the map belongs to
 * @param shared whether the map is shared between accounts
 * @param acknowledgeRequiredBy deadline for acknowledgement, epoch milliseconds
 * @param previouslyAcknowledgedOn last acknowledgement, epoch milliseconds
 * @param id the map ID
 * @param latestTicketId the latest change ticket
 * @param mapAlias the map alias
 * @param mcmMapRuleId the map rule ID
 */
public record SiteShieldMap(
    boolean acknowledged,
    List<String> contacts,
    List<String> currentCidrs,
    List<String> proposedCidrs,
    String ruleName,
    String type,
    String service,
    boolean shared,
    long acknowledgeRequiredBy,
    long previouslyAcknowledgedOn,
    @OmitEmpty int id,
    @OmitEmpty int latestTicketId,
    @OmitEmpty String mapAlias,
    @OmitEmpty int mcmMapRuleId) {}
