package com.gt.vsrs.model;

public record ContentCorrection(FieldUpdate<String> text, FieldUpdate<String> translation) {

    public static final ContentCorrection NONE = new ContentCorrection(FieldUpdate.unchanged(), FieldUpdate.unchanged());

    public ContentCorrection {
        text = text == null ? FieldUpdate.unchanged() : text;
        translation = translation == null ? FieldUpdate.unchanged() : translation;
    }

    public static ContentCorrection fromNullable(String text, String translation) {
        return new ContentCorrection(FieldUpdate.ofNullable(text), FieldUpdate.ofNullable(translation));
    }

    public boolean isEmpty() {
        return !text.isSet() && !translation.isSet();
    }

    public Item applyTo(Item item) {
        return item.withContent(text.orElse(item.text()), translation.orElse(item.translation()));
    }
}
