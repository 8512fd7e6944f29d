/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.index;

import ai.evacortex.mosaic.core.Tile;

/**
 * Result of a nearest-tile query.
 *
 * @param tile     the closest tile
 * @param position insertion index of the tile in its tile set
 * @param distance metric distance between the query and the tile signature
 */
public record TileMatch(Tile tile, int position, double distance) {}
