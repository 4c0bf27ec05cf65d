/**
 * Thread and JSON helpers shared by the channel adapters.
 */
package io.fanout.util;
