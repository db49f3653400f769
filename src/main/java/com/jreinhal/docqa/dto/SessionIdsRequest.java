package com.jreinhal.docqa.dto;

import java.util.List;

/**
 * Body of summarize, compare and similarity requests.
 */
public record SessionIdsRequest(List<String> sessionIds) {
}
