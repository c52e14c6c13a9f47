/**
 * Decodes the Art-Net packets of interest when monitoring a lighting network, and builds the ArtPoll used to
 * discover nodes.
 */
package org.deepsymmetry.lxmonitor.artnet;
