package org.realityforge.sqldeploy.notify;

record WebhookPayload(String recipient, String subject, String body) {}
