package org.realityforge.sqldeploy.db;

public record DatabaseConnection(String host, int port, String database, String username, String password) {
    @Override
    public String toString() {
        return "DatabaseConnection[host=" + host + ", port=" + port + ", database=" + database + ", username="
                + username + ", password=****]";
    }
}
