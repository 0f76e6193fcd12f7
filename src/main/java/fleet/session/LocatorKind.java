package fleet.session;

import org.openqa.selenium.By;

/**
 * How a selector string is interpreted when locating an element.
 */
public enum LocatorKind {
    CSS, XPATH, ID, NAME;

    /** Converts {@code selector} to a Selenium {@link By} for this strategy. */
    public By toBy(String selector) {
        return switch (this) {
            case ID    -> By.id(selector);
            case NAME  -> By.name(selector);
            case XPATH -> By.xpath(selector);
            default    -> By.cssSelector(selector);
        };
    }
}
