/**
 * Decodes streaming ACN (ANSI E1.31) data, synchronization and universe discovery packets.
 */
package org.deepsymmetry.lxmonitor.sacn;
