package dev.jbang.sitecache;

import dev.jbang.sitecache.client.ClientFactory;
import dev.jbang.sitecache.client.ScrapingClient;
import dev.jbang.sitecache.config.SiteConfig;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/** Fetch command printing the raw HTML of a single page */
@Command(name = "fetch", description = "Fetch a page with an authenticated session and print it", mixinStandardHelpOptions = true)
public class FetchCommand implements Callable<Integer> {

	@Mixin
	SiteOptions options;

	@Parameters(index = "0", description = "Path relative to the site's base URL, or an absolute URL")
	String path;

	@Option(
			names = {"-F", "--form"},
			description = "Form field to POST instead of doing a GET (name=value, repeatable)")
	Map<String, String> form;

	@Override
	public Integer call() throws Exception {
		SiteConfig config = options.config();
		try (ClientFactory clients = new ClientFactory(config)) {
			ScrapingClient client = clients.get("fetch");
			String html = form == null || form.isEmpty() ? client.fetchPage(path) : client.submitForm(path, form);
			System.out.println(html);
		}
		return 0;
	}
}
