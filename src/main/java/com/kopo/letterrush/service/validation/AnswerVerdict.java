package com.kopo.letterrush.service.validation;

public record AnswerVerdict(boolean valid, String reason) {

    public static AnswerVerdict valid(String reason) {
        return new AnswerVerdict(true, reason);
    }

    public static AnswerVerdict invalid(String reason) {
        return new AnswerVerdict(false, reason);
    }
}
