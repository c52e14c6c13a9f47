/**
 * Optional promiscuous capture of lighting traffic, which can see packets sent to other hosts and so discover
 * devices that only receive. Requires libpcap or Npcap to be installed.
 */
package org.deepsymmetry.lxmonitor.capture;
