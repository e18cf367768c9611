/**
 * Rate limiting for remote calls and authentication attempts.
 */
package com.mimecast.labeller.quota;
