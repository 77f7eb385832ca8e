package io.mindprint.core.sync;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a hardware-stable user id from the first MAC address (falling back to the host name)
 * and a host fingerprint. The raw host name and MAC never leave this class.
 */
public final class InstallationProbe {
    private static final Logger LOG = LoggerFactory.getLogger(InstallationProbe.class);
    private static final int USER_ID_LENGTH = 32;

    public Installation probe() {
        String host = hostName();
        String hardware = firstMacAddress().orElse(host);
        String userId = sha256(hardware).substring(0, USER_ID_LENGTH);
        String fingerprint = sha256(host + "|" + System.getProperty("os.name", "") + "|" + System.getProperty("os.arch", ""));
        return new Installation(userId, fingerprint, metadata());
    }

    static Map<String, String> metadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("osName", System.getProperty("os.name", "unknown"));
        metadata.put("osVersion", System.getProperty("os.version", "unknown"));
        metadata.put("arch", System.getProperty("os.arch", "unknown"));
        metadata.put("javaVersion", System.getProperty("java.version", "unknown"));
        return metadata;
    }

    private Optional<String> firstMacAddress() {
        try {
            List<NetworkInterface> interfaces = new ArrayList<>(Collections.list(NetworkInterface.getNetworkInterfaces()));
            interfaces.sort(Comparator.comparing(NetworkInterface::getName));
            for (NetworkInterface candidate : interfaces) {
                if (candidate.isLoopback() || candidate.isVirtual()) {
                    continue;
                }
                byte[] address = candidate.getHardwareAddress();
                if (address != null && address.length > 0) {
                    return Optional.of(HexFormat.ofDelimiter(":").formatHex(address));
                }
            }
        } catch (SocketException e) {
            LOG.debug("Network interfaces unavailable, using host name for installation id", e);
        }
        return Optional.empty();
    }

    private String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            LOG.debug("Local host name unavailable", e);
            return "localhost";
        }
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
