package com.example.licitacoes.server.index;

/**
 * @param clusterStatus green/yellow/red, or "unreachable"
 */
public record IndexHealth(boolean reachable, String clusterStatus) {

    public static IndexHealth unreachable() {
        return new IndexHealth(false, "unreachable");
    }
}
