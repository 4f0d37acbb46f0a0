/**
 * JavaOSC-backed codec implementations. JavaOSC types MUST NOT escape this
 * package.
 */
package com.questrail.mixer.protocol.osc.codec.impl;
