package org.waabox.radarkeep.spring;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.waabox.radarkeep.catalog.CatalogProvider;
import org.waabox.radarkeep.catalog.JsonCatalogLoader;
import org.waabox.radarkeep.match.CatalogMatcher;
import org.waabox.radarkeep.match.MatcherSettings;
import org.waabox.radarkeep.match.PriorRadarLookup;
import org.waabox.radarkeep.metrics.NoopRadarKeepMetrics;
import org.waabox.radarkeep.metrics.RadarKeepMetrics;
import org.waabox.radarkeep.store.LockPolicy;
import org.waabox.radarkeep.store.RecordStore;
import org.waabox.radarkeep.store.fs.FileSystemRecordStore;
import org.waabox.radarkeep.store.fs.JacksonRecordCodec;
import org.waabox.radarkeep.submission.BlipSubmission;

/**
 * Spring Boot auto-configuration for RadarKeep.
 *
 * <p>Creates the {@link PriorRadarLookup} used to find a submitted name in
 * earlier radar editions, and the {@link RecordStore} that keeps
 * {@link BlipSubmission submissions}. Every bean backs off when the
 * application defines its own of the same type, so a custom
 * {@link CatalogProvider} (e.g. classpath-bundled data) or a custom store
 * can replace the file-based defaults.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(RadarKeepProperties.class)
public class RadarKeepAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      RadarKeepAutoConfiguration.class);

  /**
   * Creates the no-op metrics reporter used when the application does not
   * provide one.
   *
   * @return the metrics reporter, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public RadarKeepMetrics radarKeepMetrics() {
    return new NoopRadarKeepMetrics();
  }

  /**
   * Creates the catalog provider over the configured snapshot directory.
   *
   * @param properties the configuration properties, never null
   *
   * @return the catalog provider, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public CatalogProvider catalogProvider(
      final RadarKeepProperties properties) {
    final RadarKeepProperties.Catalog catalog = properties.getCatalog();
    final JsonCatalogLoader loader =
        new JsonCatalogLoader(Path.of(catalog.getDir()));
    log.info("RadarKeep reading prior radars from {} ({}), data available:"
        + " {}", loader.directory(), catalog.getPolicy(),
        loader.isAvailable());
    return CatalogProvider.of(loader, catalog.getPolicy());
  }

  /**
   * Creates the name matcher.
   *
   * @param properties the configuration properties, never null
   *
   * @return the matcher, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public CatalogMatcher catalogMatcher(final RadarKeepProperties properties) {
    final RadarKeepProperties.Matcher matcher = properties.getMatcher();
    return new CatalogMatcher(MatcherSettings.of(matcher.getThreshold(),
        matcher.getSuffixes()));
  }

  /**
   * Creates the prior-radar lookup.
   *
   * @param catalogProvider the catalog provider, never null
   * @param catalogMatcher  the matcher, never null
   * @param metrics         the metrics reporter, never null
   *
   * @return the lookup, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public PriorRadarLookup priorRadarLookup(
      final CatalogProvider catalogProvider,
      final CatalogMatcher catalogMatcher,
      final RadarKeepMetrics metrics) {
    return new PriorRadarLookup(catalogProvider, catalogMatcher, metrics);
  }

  /**
   * Creates the file-based submission store.
   *
   * @param properties the configuration properties, never null
   * @param metrics    the metrics reporter, never null
   *
   * @return the submission store, never null
   */
  @Bean
  @ConditionalOnMissingBean(RecordStore.class)
  public RecordStore<BlipSubmission> submissionStore(
      final RadarKeepProperties properties,
      final RadarKeepMetrics metrics) {
    final RadarKeepProperties.Store store = properties.getStore();

    final FileSystemRecordStore.Builder<BlipSubmission> builder =
        FileSystemRecordStore.builder(
            new JacksonRecordCodec<>(BlipSubmission.class))
        .lockPolicy(LockPolicy.of(store.getLockRetryDelay(),
            store.getLockTimeout()))
        .metrics(metrics);

    final String path = store.getPath();
    if (path != null && !path.isBlank()) {
      builder.path(Path.of(path));
    }

    final FileSystemRecordStore<BlipSubmission> submissionStore =
        builder.build();
    log.info("RadarKeep storing submissions in {}, storage available: {}",
        submissionStore.path(), submissionStore.isAvailable());
    return submissionStore;
  }
}
