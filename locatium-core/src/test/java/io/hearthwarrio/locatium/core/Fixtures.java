package io.hearthwarrio.locatium.core;

/**
 * Page sources shared by tests.
 */
public final class Fixtures {

    public static final String ANDROID_LOGIN =
            "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\" ?>\n" +
            "<hierarchy index=\"0\" class=\"hierarchy\" rotation=\"0\">\n" +
            "  <android.widget.FrameLayout class=\"android.widget.FrameLayout\" package=\"com.app\" enabled=\"true\" displayed=\"true\">\n" +
            "    <android.widget.LinearLayout class=\"android.widget.LinearLayout\" enabled=\"true\" displayed=\"true\">\n" +
            "      <android.widget.EditText class=\"android.widget.EditText\" resource-id=\"com.app:id/username\" text=\"Username\" clickable=\"true\" focusable=\"true\" enabled=\"true\" displayed=\"true\"/>\n" +
            "      <android.widget.EditText class=\"android.widget.EditText\" resource-id=\"com.app:id/password\" text=\"Password\" clickable=\"true\" focusable=\"true\" enabled=\"true\" displayed=\"true\"/>\n" +
            "      <android.widget.Button class=\"android.widget.Button\" resource-id=\"com.app:id/login\" text=\"Log in\" content-desc=\"login\" clickable=\"true\" enabled=\"true\" displayed=\"true\"/>\n" +
            "    </android.widget.LinearLayout>\n" +
            "  </android.widget.FrameLayout>\n" +
            "</hierarchy>";

    public static final String IOS_WELCOME =
            "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" +
            "<XCUIElementTypeApplication type=\"XCUIElementTypeApplication\" name=\"Demo\" label=\"Demo\">\n" +
            "  <XCUIElementTypeWindow type=\"XCUIElementTypeWindow\">\n" +
            "    <XCUIElementTypeOther type=\"XCUIElementTypeOther\">\n" +
            "      <XCUIElementTypeButton type=\"XCUIElementTypeButton\" name=\"Login\" label=\"Login\"/>\n" +
            "      <XCUIElementTypeStaticText type=\"XCUIElementTypeStaticText\" value=\"Welcome\"/>\n" +
            "      <XCUIElementTypeStaticText type=\"XCUIElementTypeStaticText\" value=\"Welcome\"/>\n" +
            "    </XCUIElementTypeOther>\n" +
            "  </XCUIElementTypeWindow>\n" +
            "</XCUIElementTypeApplication>";

    private Fixtures() {
    }

    public static UiTree parse(String source) {
        return new UiTreeParser().parse(source);
    }
}
