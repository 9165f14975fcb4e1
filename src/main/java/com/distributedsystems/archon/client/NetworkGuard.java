package com.distributedsystems.archon.client;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;

/**
 * Rejects destinations that are not globally routable: loopback, private, link-local,
 * unique-local, multicast, shared (CGNAT), documentation, benchmarking and reserved space.
 */
public final class NetworkGuard {

    private NetworkGuard() {
    }

    public static boolean isPubliclyRoutable(InetAddress address) {
        return !isNonRoutable(address);
    }

    public static boolean isNonRoutable(InetAddress address) {
        if (address == null) return true;
        if (address.isAnyLocalAddress()
                || address.isLoopbackAddress()
                || address.isLinkLocalAddress()
                || address.isSiteLocalAddress()
                || address.isMulticastAddress()) {
            return true;
        }
        if (address instanceof Inet4Address) {
            return isReservedV4(address.getAddress());
        }
        if (address instanceof Inet6Address) {
            return isReservedV6(address.getAddress());
        }
        return true;
    }

    private static boolean isReservedV4(byte[] a) {
        int b0 = a[0] & 0xff;
        int b1 = a[1] & 0xff;
        int b2 = a[2] & 0xff;
        if (b0 == 0 || b0 == 10 || b0 == 127) return true;
        if (b0 == 100 && (b1 & 0xc0) == 64) return true;          // 100.64.0.0/10
        if (b0 == 169 && b1 == 254) return true;
        if (b0 == 172 && (b1 & 0xf0) == 16) return true;
        if (b0 == 192 && b1 == 168) return true;
        if (b0 == 192 && b1 == 0 && (b2 == 0 || b2 == 2)) return true;
        if (b0 == 198 && (b1 == 18 || b1 == 19)) return true;     // benchmarking
        if (b0 == 198 && b1 == 51 && b2 == 100) return true;
        if (b0 == 203 && b1 == 0 && b2 == 113) return true;
        return b0 >= 224;                                          // multicast, 240/4, broadcast
    }

    private static boolean isReservedV6(byte[] a) {
        int b0 = a[0] & 0xff;
        int b1 = a[1] & 0xff;
        if ((b0 & 0xfe) == 0xfc) return true;                      // fc00::/7
        if (b0 == 0xfe && (b1 & 0xc0) == 0x80) return true;        // fe80::/10
        if (b0 == 0xff) return true;
        if (b0 == 0x20 && b1 == 0x01 && (a[2] & 0xff) == 0x0d && (a[3] & 0xff) == 0xb8) return true;
        if (isV4Mapped(a)) {
            byte[] v4 = new byte[]{a[12], a[13], a[14], a[15]};
            return isReservedV4(v4);
        }
        boolean allZeroPrefix = true;
        for (int i = 0; i < 15; i++) {
            if (a[i] != 0) {
                allZeroPrefix = false;
                break;
            }
        }
        return allZeroPrefix;                                      // :: and ::1
    }

    private static boolean isV4Mapped(byte[] a) {
        for (int i = 0; i < 10; i++) {
            if (a[i] != 0) return false;
        }
        return (a[10] & 0xff) == 0xff && (a[11] & 0xff) == 0xff;
    }
}
