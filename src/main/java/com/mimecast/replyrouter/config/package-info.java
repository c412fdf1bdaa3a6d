/**
 * Configuration files and their accessors.
 *
 * <p>Configuration files are JSON5 and read into maps with Gson.
 * <br>{@link com.mimecast.replyrouter.config.BasicConfig} wraps a map with typed getters and defaults.
 *
 * <p>Incoming email configuration lives in `incoming-email.json5`:
 * <ul>
 *     <li>`enabled` Worker enablement.</li>
 *     <li>`address` Reply address template with a `%{key}` placeholder.</li>
 *     <li>`host` Host of fallback reply message ids.</li>
 *     <li>`autoGeneratedPattern` Header marker of automatic replies.</li>
 *     <li>`rejection` Rejection notice options.</li>
 *     <li>`attachments` Local attachment storage options.</li>
 * </ul>
 *
 * @see com.mimecast.replyrouter.config.IncomingEmailConfig
 */
package com.mimecast.replyrouter.config;
