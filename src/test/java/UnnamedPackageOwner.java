/**
 * Fixture: a class in the unnamed package, loaded by name from tests.
 */
class UnnamedPackageOwner {
}
