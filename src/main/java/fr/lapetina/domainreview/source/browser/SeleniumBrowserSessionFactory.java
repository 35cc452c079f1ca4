package fr.lapetina.domainreview.source.browser;

import fr.lapetina.domainreview.domain.model.FailureType;
import fr.lapetina.domainreview.infrastructure.config.ReviewConfig;
import fr.lapetina.domainreview.source.SourceLookupException;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.openqa.selenium.firefox.GeckoDriverService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Headless Firefox sessions driven through geckodriver.
 */
public final class SeleniumBrowserSessionFactory implements BrowserSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserSessionFactory.class);

    private final ReviewConfig.BrowserConfig config;

    public SeleniumBrowserSessionFactory(ReviewConfig.BrowserConfig config) {
        this.config = config;
    }

    @Override
    public BrowserSession open() throws SourceLookupException {
        FirefoxOptions options = new FirefoxOptions();
        if (config.isHeadless()) {
            options.addArguments("-headless");
        }
        GeckoDriverService service = new GeckoDriverService.Builder()
                .usingDriverExecutable(new File(config.getGeckodriverPath()))
                .build();
        try {
            FirefoxDriver driver = new FirefoxDriver(service, options);
            driver.manage().timeouts().pageLoadTimeout(Duration.ofMillis(config.getPageLoadTimeoutMs()));
            log.debug("Browser session started: driver={}", config.getGeckodriverPath());
            return new SeleniumBrowserSession(driver);
        } catch (WebDriverException e) {
            throw new SourceLookupException(FailureType.INTERNAL, "browser failed to start: " + e.getMessage(), e);
        }
    }

    private static final class SeleniumBrowserSession implements BrowserSession {

        private final FirefoxDriver driver;

        private SeleniumBrowserSession(FirefoxDriver driver) {
            this.driver = driver;
        }

        @Override
        public void navigate(String url) throws SourceLookupException {
            try {
                driver.get(url);
            } catch (TimeoutException e) {
                throw new SourceLookupException(FailureType.TIMEOUT, "timeout", e);
            } catch (WebDriverException e) {
                throw new SourceLookupException(FailureType.NETWORK, "page load failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void typeInto(String elementId, String text) throws SourceLookupException {
            try {
                WebElement input = driver.findElement(By.id(elementId));
                input.clear();
                input.sendKeys(text);
            } catch (NoSuchElementException e) {
                throw SourceLookupException.unexpectedPage();
            } catch (WebDriverException e) {
                throw new SourceLookupException(FailureType.UNEXPECTED_RESPONSE, e.getMessage(), e);
            }
        }

        @Override
        public void runScript(String script) throws SourceLookupException {
            try {
                ((JavascriptExecutor) driver).executeScript(script);
            } catch (WebDriverException e) {
                throw new SourceLookupException(FailureType.UNEXPECTED_RESPONSE, "script failed: " + e.getMessage(), e);
            }
        }

        @Override
        public Optional<String> textOfFirstByClass(String className) throws SourceLookupException {
            try {
                List<WebElement> elements = driver.findElements(By.className(className));
                return elements.isEmpty() ? Optional.empty() : Optional.of(elements.get(0).getText());
            } catch (WebDriverException e) {
                throw new SourceLookupException(FailureType.UNEXPECTED_RESPONSE, e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            try {
                driver.quit();
            } catch (WebDriverException e) {
                log.warn("Error closing browser session: {}", e.getMessage());
            }
        }
    }
}
