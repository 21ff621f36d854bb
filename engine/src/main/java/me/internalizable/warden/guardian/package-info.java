/**
 * Background loops that sample CPU/RAM usage and enforce thresholds.
 */
package me.internalizable.warden.guardian;
