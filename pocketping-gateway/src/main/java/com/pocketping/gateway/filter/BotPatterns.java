package com.pocketping.gateway.filter;

import java.util.List;

/**
 * Built-in User-Agent substrings of crawlers, monitors, headless browsers and
 * HTTP libraries.
 */
public final class BotPatterns {

    private BotPatterns() {
    }

    public static final List<String> DEFAULTS = List.of(
            // search engines
            "googlebot", "bingbot", "slurp", "duckduckbot", "baiduspider",
            "yandexbot", "sogou", "exabot", "facebot", "ia_archiver",
            // SEO and analytics
            "semrushbot", "ahrefsbot", "mj12bot", "dotbot", "rogerbot",
            "screaming frog", "seokicks", "sistrix", "linkdexbot", "blexbot",
            // generic automation
            "bot/", "crawler", "spider", "scraper", "headless",
            "phantomjs", "selenium", "puppeteer", "playwright", "webdriver",
            // uptime monitors
            "pingdom", "uptimerobot", "statuscake", "site24x7", "newrelic",
            "datadog", "gtmetrix", "pagespeed",
            // link previews
            "twitterbot", "linkedinbot", "pinterestbot", "telegrambot",
            "whatsapp", "slackbot", "discordbot", "applebot",
            // LLM crawlers
            "gptbot", "chatgpt-user", "anthropic-ai", "claude-web",
            "perplexitybot", "ccbot", "bytespider", "cohere-ai",
            // HTTP libraries
            "curl/", "wget/", "httpie/", "python-requests", "python-urllib",
            "axios/", "node-fetch", "go-http-client", "java/", "okhttp",
            "libwww-perl", "httpclient",
            // archives
            "archive.org_bot", "wayback", "commoncrawl",
            // scanners
            "nmap", "nikto", "sqlmap", "masscan", "zgrab");

    /** True when the User-Agent matches a built-in pattern (for testing). */
    static boolean isBot(String userAgent) {
        return UserAgentFilter.firstMatch(userAgent, DEFAULTS) != null;
    }
}
