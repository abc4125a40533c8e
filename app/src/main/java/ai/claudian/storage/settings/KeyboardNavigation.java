package ai.claudian.storage.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Vim-style keys for scrolling the chat and focusing the input. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyboardNavigation(String scrollUpKey, String scrollDownKey, String focusInputKey) {

    public static KeyboardNavigation defaults() {
        return new KeyboardNavigation("w", "s", "i");
    }
}
