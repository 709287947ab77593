package stableid;

import stableid.generator.GeneratorOptions;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Shared HTML pages and options for tests.
 */
public final class Fixtures {

    private Fixtures() {}

    public static final Instant GENERATED_AT = Instant.parse("2024-01-01T00:00:00Z");

    public static final String LOGIN_FORM = """
            <html><body>
              <form id="login" class="login-form">
                <input name="user" type="text">
                <button type="submit">Sign in</button>
              </form>
            </body></html>
            """;

    public static final String LOGIN_FORM_WITHOUT_BUTTON = """
            <html><body>
              <form id="login" class="login-form">
                <input name="user" type="text">
              </form>
            </body></html>
            """;

    public static final String SHOP = """
            <html><body>
              <main id="shop"><button class="buy-button" type="button">Buy</button></main>
            </body></html>
            """;

    /** Same button three times, two of them hidden. */
    public static final String SHOP_WITH_HIDDEN_COPIES = """
            <html><body>
              <main id="shop">
                <button class="buy-button" type="button" style="display: none">Buy</button>
                <button class="buy-button" type="button">Buy</button>
                <div hidden><button class="buy-button" type="button">Buy</button></div>
              </main>
            </body></html>
            """;

    /** Two list items that are indistinguishable except by position. */
    public static final String TWIN_ITEMS = """
            <html><body>
              <main>
                <ul>
                  <li><button type="button">Add</button></li>
                  <li><button type="button">Add</button></li>
                </ul>
              </main>
            </body></html>
            """;

    public static GeneratorOptions fixedClockOptions() {
        return GeneratorOptions.builder()
                .clock(Clock.fixed(GENERATED_AT, ZoneOffset.UTC))
                .build();
    }
}
