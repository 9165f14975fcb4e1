package com.distributedsystems.archon.client;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * DNS lookup seam, replaced in tests to pin host names to fixed addresses.
 */
@FunctionalInterface
public interface HostResolver {

    InetAddress[] resolve(String host) throws UnknownHostException;

    static HostResolver system() {
        return InetAddress::getAllByName;
    }
}
