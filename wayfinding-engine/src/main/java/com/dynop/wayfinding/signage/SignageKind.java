package com.dynop.wayfinding.signage;

/**
 * Kind of wayfinding cue.
 *
 * <ul>
 *   <li>{@link #SIGN} - Directional or identification sign</li>
 *   <li>{@link #LANDMARK} - Distinctive feature people orient by (artwork, atrium, kiosk)</li>
 * </ul>
 */
public enum SignageKind {
    SIGN,
    LANDMARK
}
