package ch.tictactoe.tictactoebackend.web.api.dto;

import java.util.List;

/**
 * Wrapper for the list of recent games, newest first.
 *
 * @param items games
 */
public record GameListDto(
        List<GameDto> items
) {}
