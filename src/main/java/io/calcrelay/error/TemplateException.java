package io.calcrelay.error;

public class TemplateException extends CalcJobException {
    public TemplateException(String message) {
        super(message, false);
    }
}
