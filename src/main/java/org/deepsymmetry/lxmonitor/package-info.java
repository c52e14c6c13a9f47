/**
 * <p>A library for watching Art-Net and streaming ACN (E1.31) lighting control networks, keeping track of the
 * devices found on them, and diagnosing problems like low frame rates, packet loss, irregular timing, and
 * universes being sent by more than one source.</p>
 *
 * <p>This top level package provides the {@link org.deepsymmetry.lxmonitor.NetworkMonitor}, which listens for
 * both protocols and keeps the registry of sources and the latest DMX frame of each universe up to date, along
 * with the listener interface for hearing about changes. The protocol decoders are found in the
 * {@link org.deepsymmetry.lxmonitor.artnet} and {@link org.deepsymmetry.lxmonitor.sacn} packages, the source
 * registry and frame store in {@link org.deepsymmetry.lxmonitor.data}, and optional promiscuous packet capture in
 * {@link org.deepsymmetry.lxmonitor.capture}.</p>
 */
package org.deepsymmetry.lxmonitor;
