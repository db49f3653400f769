package com.jreinhal.docqa.dto;

import java.util.List;

public record AskRequest(String question, List<String> sessionIds) {
}
