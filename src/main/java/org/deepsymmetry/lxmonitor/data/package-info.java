/**
 * The state built up from decoded traffic: the registry of sources with their statistics, and the latest DMX
 * frame of each universe.
 */
package org.deepsymmetry.lxmonitor.data;
