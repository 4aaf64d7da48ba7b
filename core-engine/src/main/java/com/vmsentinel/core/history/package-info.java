/**
 * Caller-owned alert history.
 *
 * @since 1.0.0
 */
package com.vmsentinel.core.history;
