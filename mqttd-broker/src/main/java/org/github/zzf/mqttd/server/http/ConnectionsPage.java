package org.github.zzf.mqttd.server.http;

import java.time.ZonedDateTime;

/**
 * Renders a {@link ConnectionTable} as the /connections HTML page. Every value is HTML-escaped.
 */
final class ConnectionsPage {

    private static final String HEAD = """
        <html lang="en">
        <head>
            <meta content="text/html; charset=utf-8" http-equiv="content-type" />
            <script language="JavaScript">
                setTimeout(function () { window.location.reload(); }, 180000);
            </script>
            <style type="text/css">
                h3 { margin: 20px 0 10px; font-weight: bold; font-size: 18px; }
                a { color: #4183C4; font-size: 16px; }
                table { padding: 0; }
                table tr { border-top: 1px solid #000000; background-color: #ffffff; }
                table tr:nth-child(2n) { background-color: #eeffee; }
                table tr th { font-weight: bold; background-color: #fffddd; border: 1px solid #cccccc; padding: 6px 13px; }
                table tr td { border: 1px solid #cccccc; text-align: center; padding: 6px 13px; }
                table tr td:nth-of-type(2) { text-align: left; }
                table tr td:nth-of-type(7) { text-align: left; width: 700px; white-space: pre-wrap; }
            </style>
            <title>Broker Information</title>
        </head>
        """;

    private static final String TABLE_HEAD = """
            <table>
                <thead>
                    <tr>
                        <th>Client User</th>
                        <th>Client ID</th>
                        <th>Client IP</th>
                        <th>Client Ver</th>
                        <th>Protocol</th>
                        <th>Subscribes</th>
                        <th>Subscribe Detail</th>
                    </tr>
                </thead>
                <tbody>
        """;

    private ConnectionsPage() {
    }

    static String render(ConnectionTable table, long uptimeSeconds, String listeners) {
        StringBuilder sb = new StringBuilder(4096).append(HEAD).append("<body>\n");
        section(sb, "Current Time:", ZonedDateTime.now().toString());
        section(sb, "Uptime", formatSeconds(uptimeSeconds));
        section(sb, "Listeners:", listeners);
        section(sb, "Clients", table.countsText());
        sb.append(TABLE_HEAD);
        for (ConnectionTable.Row r : table.rows()) {
            sb.append("            <tr>");
            cell(sb, r.username());
            cell(sb, r.clientId());
            cell(sb, r.remote());
            cell(sb, String.valueOf(r.protocolVersion()));
            cell(sb, r.listener());
            cell(sb, String.valueOf(r.subscriptions().size()));
            cell(sb, r.subscriptionsText());
            sb.append("</tr>\n");
        }
        return sb.append("        </tbody>\n    </table>\n</body>\n</html>\n").toString();
    }

    private static void section(StringBuilder sb, String title, String value) {
        sb.append("    <h3>").append(escape(title)).append("</h3><a>").append(escape(value)).append("</a>\n");
    }

    private static void cell(StringBuilder sb, String value) {
        sb.append("<td>").append(escape(value)).append("</td>");
    }

    /**
     * 90061 -> "1d 1h 1m 1s"
     */
    static String formatSeconds(long seconds) {
        long d = seconds / 86400;
        long h = seconds % 86400 / 3600;
        long m = seconds % 3600 / 60;
        long s = seconds % 60;
        StringBuilder sb = new StringBuilder();
        if (d > 0) {
            sb.append(d).append("d ");
        }
        if (d > 0 || h > 0) {
            sb.append(h).append("h ");
        }
        if (d > 0 || h > 0 || m > 0) {
            sb.append(m).append("m ");
        }
        return sb.append(s).append('s').toString();
    }

    static String escape(String s) {
        if (s == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append("&amp;");
                case '"' -> sb.append("&#34;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

}
