package vpnmanager.adapter.in.dto;

/**
 * DTO for a certificate search together with the echoed filter.
 *
 * @param subject the subject filter, HTML-escaped, null if none was given
 * @param type the type filter, null if none was given
 * @param includeRevoked whether revoked certificates are listed
 * @param results the matching page
 */
public record CertificateSearchDto(
        String subject, String type, boolean includeRevoked, PageDto<CertificateDto> results) {}
