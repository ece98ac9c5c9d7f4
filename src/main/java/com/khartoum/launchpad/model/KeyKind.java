package com.khartoum.launchpad.model;

import java.util.Set;

/**
 * Known credential kinds. The kind column is an open string so new providers
 * can be stored without a schema change.
 */
public final class KeyKind {

    public static final String DATABASE_URL = "database_url";
    public static final String DATABASE_ANON_KEY = "database_anon_key";
    public static final String DATABASE_SERVICE_ROLE = "database_service_role";
    public static final String PLATFORM_TOKEN = "platform_token";

    public static final String GOOGLE_MAPS = "google_maps";
    public static final String GEMINI = "gemini";
    public static final String OPENAI = "openai";
    public static final String ANTHROPIC = "anthropic";
    public static final String RESEND = "resend";
    public static final String SENDGRID = "sendgrid";

    public static final Set<String> AI_PROVIDERS = Set.of(GEMINI, OPENAI, ANTHROPIC);
    public static final Set<String> EMAIL_PROVIDERS = Set.of(RESEND, SENDGRID);

    private KeyKind() {
    }
}
